package com.rhythm360.monitor.exports;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/** Write-only {@code text/csv} converter for {@link CsvDocument} bodies. */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<CsvDocument<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return CsvDocument.class.isAssignableFrom(clazz);
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected CsvDocument<?> readInternal(@NonNull Class<? extends CsvDocument<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull CsvDocument<?> document,
      @NonNull HttpOutputMessage outputMessage) throws IOException, HttpMessageNotWritableException {
    write(document, outputMessage.getBody());
  }

  public void write(CsvDocument<?> document, OutputStream out) throws IOException {
    CsvSchema schema = mapper.schemaFor(document.rowType()).withHeader();
    if (document.rows().isEmpty()) {
      // the generator only emits the header together with the first row
      out.write(headerLine(schema).getBytes(StandardCharsets.UTF_8));
      out.flush();
      return;
    }
    SequenceWriter writer = mapper.writer(schema).writeValues(out);
    for (Object row : document.rows()) {
      writer.write(row);
    }
    writer.flush();
  }

  private static String headerLine(CsvSchema schema) {
    StringJoiner joiner = new StringJoiner(String.valueOf(schema.getColumnSeparator()));
    for (CsvSchema.Column column : schema) {
      joiner.add(column.getName());
    }
    return joiner + new String(schema.getLineSeparator());
  }
}
