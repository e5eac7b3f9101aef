package com.aiusage.canonicalizer.UnitTests.service.data_processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.aiusage.canonicalizer.exception.EmptyInputException;
import com.aiusage.canonicalizer.exception.UnreadableSourceException;
import com.aiusage.canonicalizer.model.RawTable;
import com.aiusage.canonicalizer.service.data_processing.SpreadsheetParsingService;

class SpreadsheetParsingServiceTest {

  private SpreadsheetParsingService spreadsheetParsingService;

  @BeforeEach
  void setUp() {
    spreadsheetParsingService = new SpreadsheetParsingService();
  }

  private static byte[] surveyWorkbook(Workbook workbook) throws IOException {
    try (workbook) {
      Sheet sheet = workbook.createSheet("Responses");
      Row header = sheet.createRow(0);
      header.createCell(0).setCellValue("AI Tool Used");
      header.createCell(1).setCellValue("Usage Frequency");
      header.createCell(2).setCellValue("Ease of Use");

      Row first = sheet.createRow(1);
      first.createCell(0).setCellValue("ChatGPT");
      first.createCell(1).setCellValue("Daily");
      first.createCell(2).setCellValue(4);

      sheet.createRow(2);

      Row third = sheet.createRow(3);
      third.createCell(0).setCellValue("Claude");
      third.createCell(2).setCellValue(5);

      workbook.createSheet("Ignored").createRow(0).createCell(0).setCellValue("other");

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      workbook.write(out);
      return out.toByteArray();
    }
  }

  @Test
  void shouldReadFirstSheetOfXlsx() throws IOException {
    byte[] content = surveyWorkbook(new XSSFWorkbook());

    RawTable table =
        spreadsheetParsingService.parse(new ByteArrayInputStream(content), "survey.xlsx");

    assertThat(table.getHeaders())
        .containsExactly("AI Tool Used", "Usage Frequency", "Ease of Use");
    assertThat(table.rowCount()).isEqualTo(2);
    assertThat(table.getRows().get(0)).containsExactly("ChatGPT", "Daily", "4");
    assertThat(table.getRows().get(1)).containsExactly("Claude", "", "5");
  }

  @Test
  void shouldReadLegacyXls() throws IOException {
    byte[] content = surveyWorkbook(new HSSFWorkbook());

    RawTable table =
        spreadsheetParsingService.parse(new ByteArrayInputStream(content), "survey.xls");

    assertThat(table.getHeaders()).hasSize(3);
    assertThat(table.getRows().get(0).get(0)).isEqualTo("ChatGPT");
  }

  @Test
  void shouldRejectHeaderOnlyWorkbook() throws IOException {
    byte[] content;
    try (Workbook workbook = new XSSFWorkbook()) {
      workbook.createSheet().createRow(0).createCell(0).setCellValue("AI Tool Used");
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      workbook.write(out);
      content = out.toByteArray();
    }

    assertThatThrownBy(
            () ->
                spreadsheetParsingService.parse(
                    new ByteArrayInputStream(content), "header.xlsx"))
        .isInstanceOf(EmptyInputException.class);
  }

  @Test
  void shouldRejectBytesThatAreNotAWorkbook() {
    byte[] content = "not,a,workbook\n1,2,3".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(
            () ->
                spreadsheetParsingService.parse(new ByteArrayInputStream(content), "fake.xlsx"))
        .isInstanceOf(UnreadableSourceException.class)
        .hasMessageContaining("fake.xlsx");
  }
}
