package com.aiusage.canonicalizer.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import com.aiusage.canonicalizer.exception.EmptyInputException;
import com.aiusage.canonicalizer.exception.UnreadableSourceException;
import com.aiusage.canonicalizer.model.RawTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the first sheet of an .xlsx or .xls workbook. The first physical row is the header; cells
 * are taken as the text Excel would display. Rows without any non-blank cell are skipped.
 */
@Slf4j
@Service
public class SpreadsheetParsingService {

  public RawTable parse(InputStream workbookStream, String fileName) {
    List<String> headers = new ArrayList<>();
    List<List<Object>> rows = new ArrayList<>();

    try (Workbook workbook = WorkbookFactory.create(workbookStream)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new UnreadableSourceException("Workbook " + fileName + " has no sheets");
      }
      Sheet sheet = workbook.getSheetAt(0);
      DataFormatter formatter = new DataFormatter();
      FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

      Row headerRow = sheet.getRow(sheet.getFirstRowNum());
      if (headerRow == null || headerRow.getLastCellNum() <= 0) {
        throw new UnreadableSourceException("Workbook " + fileName + " has no header row");
      }
      int width = headerRow.getLastCellNum();
      for (int c = 0; c < width; c++) {
        headers.add(formatter.formatCellValue(headerRow.getCell(c), evaluator).trim());
      }

      for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
        Row row = sheet.getRow(r);
        if (row == null) {
          continue;
        }
        List<Object> cells = new ArrayList<>(width);
        boolean meaningful = false;
        for (int c = 0; c < width; c++) {
          Cell cell = row.getCell(c);
          String text = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
          meaningful |= !text.isBlank();
          cells.add(text);
        }
        if (meaningful) {
          rows.add(cells);
        }
      }
    } catch (IOException | EncryptedDocumentException | IllegalArgumentException e) {
      throw new UnreadableSourceException(
          "Could not read workbook " + fileName + ": " + e.getMessage(), e);
    }

    if (rows.isEmpty()) {
      throw new EmptyInputException("Workbook " + fileName + " contains no data rows");
    }

    log.info("Parsed {} with {} columns and {} rows", fileName, headers.size(), rows.size());
    return new RawTable(fileName, headers, rows);
  }
}
