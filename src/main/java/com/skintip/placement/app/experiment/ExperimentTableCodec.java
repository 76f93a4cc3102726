package com.skintip.placement.app.experiment;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.skintip.placement.app.exception.ExperimentValidationException;
import com.skintip.placement.app.model.ExperimentRow;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

/**
 * Reads and writes hill-climb tables: header-first, comma separated, UTF-8. Header order is kept
 * exactly so a table can be written back with byte-identical column order.
 */
@Log4j2
public class ExperimentTableCodec {

  private final CsvMapper mapper;

  public ExperimentTableCodec() {
    this.mapper = new CsvMapper();
    this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  /** Header plus data rows of one table. */
  @Value
  public static class ParsedTable {
    List<String> headers;
    List<ExperimentRow> rows;
  }

  public ParsedTable parse(String text) {
    if (text == null || text.isBlank()) {
      throw new ExperimentValidationException("Table is empty");
    }
    String body = text.charAt(0) == '\uFEFF' ? text.substring(1) : text;

    List<List<String>> records = new ArrayList<>();
    try (MappingIterator<List<String>> it =
        mapper.readerForListOf(String.class).with(CsvSchema.emptySchema()).readValues(body)) {
      while (it.hasNextValue()) {
        List<String> record = it.nextValue();
        if (!isBlankRecord(record)) records.add(record);
      }
    } catch (IOException | RuntimeException e) {
      throw new ExperimentValidationException("Table could not be parsed: " + e.getMessage());
    }
    if (records.isEmpty()) {
      throw new ExperimentValidationException("Table has no header row");
    }

    List<String> headers = new ArrayList<>();
    for (String h : records.get(0)) {
      headers.add(h == null ? "" : h.trim());
    }

    List<ExperimentRow> rows = new ArrayList<>();
    for (int i = 1; i < records.size(); i++) {
      List<String> record = records.get(i);
      if (record.size() > headers.size()) {
        throw new ExperimentValidationException(
            "Row " + i + " has " + record.size() + " fields but the header has " + headers.size());
      }
      Map<String, String> cells = new LinkedHashMap<>();
      for (int c = 0; c < headers.size(); c++) {
        cells.put(headers.get(c), c < record.size() && record.get(c) != null ? record.get(c) : "");
      }
      rows.add(new ExperimentRow(i - 1, cells));
    }
    log.debug("table.parse columns={} rows={}", headers.size(), rows.size());
    return new ParsedTable(List.copyOf(headers), List.copyOf(rows));
  }

  /** Writes {@code headers} then every row's cells in header order; absent cells are empty. */
  public String write(List<String> headers, List<ExperimentRow> rows) {
    CsvSchema schema = CsvSchema.emptySchema().withLineSeparator("\n");
    StringWriter out = new StringWriter();
    try (SequenceWriter writer = mapper.writer(schema).writeValues(out)) {
      writer.write(headers);
      for (ExperimentRow row : rows) {
        List<String> values = new ArrayList<>(headers.size());
        for (String h : headers) {
          values.add(row.get(h));
        }
        writer.write(values);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Table could not be written", e);
    }
    return out.toString();
  }

  private static boolean isBlankRecord(List<String> record) {
    for (String v : record) {
      if (v != null && !v.isBlank()) return false;
    }
    return true;
  }
}
