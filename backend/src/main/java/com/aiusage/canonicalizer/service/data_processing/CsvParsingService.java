package com.aiusage.canonicalizer.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Service;

import com.aiusage.canonicalizer.exception.EmptyInputException;
import com.aiusage.canonicalizer.exception.UnreadableSourceException;
import com.aiusage.canonicalizer.model.RawTable;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads delimited text into a {@link RawTable}. The first record is the header; duplicate headers
 * are kept by position. Rows are never dropped for having the wrong width: short rows are padded
 * with nulls, long rows are cut to the header width.
 */
@Slf4j
@Service
public class CsvParsingService {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  public RawTable parse(InputStream csvStream, String fileName) {
    List<String> headers;
    List<List<Object>> rows = new ArrayList<>();

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {

      String[] headerRecord = reader.readNext();
      if (headerRecord == null || isBlankLine(headerRecord)) {
        throw new UnreadableSourceException("CSV file has no headers");
      }
      headers = new ArrayList<>(Arrays.asList(headerRecord));
      headers.set(0, stripByteOrderMark(headers.get(0)));

      String[] record;
      long line = 1;
      while ((record = reader.readNext()) != null) {
        line++;
        if (isBlankLine(record)) {
          continue;
        }
        if (record.length != headers.size()) {
          log.debug(
              "Row at line {} has {} cells for {} headers, fitting to header width",
              line,
              record.length,
              headers.size());
        }
        rows.add(new ArrayList<>(Arrays.asList((Object[]) record)));
      }
    } catch (IOException | CsvValidationException e) {
      throw new UnreadableSourceException(
          "Could not read CSV file " + fileName + ": " + e.getMessage(), e);
    }

    if (rows.isEmpty()) {
      throw new EmptyInputException("CSV file " + fileName + " contains no data rows");
    }

    log.info("Parsed {} with {} columns and {} rows", fileName, headers.size(), rows.size());
    return new RawTable(fileName, headers, rows);
  }

  private boolean isBlankLine(String[] record) {
    return record.length == 1 && (record[0] == null || record[0].isBlank());
  }

  private String stripByteOrderMark(String header) {
    return header != null && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK
        ? header.substring(1)
        : header;
  }
}
