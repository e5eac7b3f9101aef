package com.aiusage.canonicalizer.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.aiusage.canonicalizer.dto.analysis.TableCanonicalizationRequest;
import com.aiusage.canonicalizer.exception.EmptyInputException;
import com.aiusage.canonicalizer.exception.UnreadableSourceException;
import com.aiusage.canonicalizer.model.RawTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Turns an uploaded file or a JSON table into a {@link RawTable}, whatever the source format. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableSourceService {

  private static final Set<String> SPREADSHEET_EXTENSIONS = Set.of("xlsx", "xls");

  private final CsvParsingService csvParsingService;
  private final SpreadsheetParsingService spreadsheetParsingService;

  public RawTable read(InputStream content, String fileName) {
    String extension = extractFileExtension(fileName);
    try (InputStream in = content) {
      if ("csv".equals(extension)) {
        return csvParsingService.parse(in, fileName);
      }
      if (SPREADSHEET_EXTENSIONS.contains(extension)) {
        return spreadsheetParsingService.parse(in, fileName);
      }
    } catch (IOException e) {
      throw new UnreadableSourceException("Could not read " + fileName, e);
    }
    throw new UnreadableSourceException(
        "Unsupported file format '" + extension + "'. Please upload CSV or Excel.");
  }

  public RawTable fromRequest(TableCanonicalizationRequest request) {
    List<String> columns = request.getColumns();
    String name = request.getTableName() != null ? request.getTableName() : "unnamed_table";

    List<List<Object>> rows = new ArrayList<>();
    if (request.getRows() != null && !request.getRows().isEmpty()) {
      rows.addAll(request.getRows());
    } else if (request.getData() != null) {
      for (Map<String, Object> record : request.getData()) {
        List<Object> row = new ArrayList<>(columns.size());
        for (String column : columns) {
          row.add(record != null ? record.get(column) : null);
        }
        rows.add(row);
      }
    }

    if (rows.isEmpty()) {
      throw new EmptyInputException("Table " + name + " contains no data rows");
    }
    log.debug("Received table {} with {} columns and {} rows", name, columns.size(), rows.size());
    return new RawTable(name, columns, rows);
  }

  public static String extractFileExtension(String fileName) {
    if (fileName == null) {
      return "";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
  }
}
