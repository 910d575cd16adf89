package com.flamingo.deckcompiler.service.writer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.deckcompiler.config.CompilerConfig;
import com.flamingo.deckcompiler.service.list.ListEntry;
import com.flamingo.deckcompiler.service.model.DateSpan;
import com.flamingo.deckcompiler.service.model.ImageContent;
import com.flamingo.deckcompiler.service.model.LinkSpan;
import com.flamingo.deckcompiler.service.model.ListContent;
import com.flamingo.deckcompiler.service.model.LiteralSpan;
import com.flamingo.deckcompiler.service.model.PlaceholderNode;
import com.flamingo.deckcompiler.service.model.Presentation;
import com.flamingo.deckcompiler.service.model.SlideNode;
import com.flamingo.deckcompiler.service.model.TableContent;
import com.flamingo.deckcompiler.service.model.TextContent;
import com.flamingo.deckcompiler.service.model.TextRun;
import com.flamingo.deckcompiler.service.model.TextSpan;
import com.flamingo.deckcompiler.service.table.TableLayout;
import com.flamingo.deckcompiler.service.table.TableSpec;
import com.flamingo.deckcompiler.service.template.LayoutDef;
import com.flamingo.deckcompiler.service.template.TemplateMapping;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the resolved tree as JSON with Jackson's streaming generator.
 *
 * <p>Field order is fixed and maps are written in their insertion order, so the same tree always
 * produces the same bytes. Dates stay symbolic (pattern only); the consumer stamps them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonPresentationWriter implements PresentationWriter {

  private final ObjectMapper objectMapper;
  private final CompilerConfig config;

  @Override
  public void write(Presentation presentation, TemplateMapping mapping, OutputStream out)
      throws IOException {
    try (JsonGenerator json = objectMapper.getFactory().createGenerator(out)) {
      json.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (config.getOutput().isPrettyPrint()) {
        json.useDefaultPrettyPrinter();
      }

      json.writeStartObject();
      writeTemplate(json, mapping);
      json.writeObjectFieldStart("labels");
      for (Map.Entry<String, Integer> label : presentation.labels().entrySet()) {
        json.writeNumberField(label.getKey(), label.getValue());
      }
      json.writeEndObject();
      json.writeArrayFieldStart("slides");
      for (SlideNode slide : presentation.slides()) {
        writeSlide(json, slide);
      }
      json.writeEndArray();
      json.writeEndObject();
    }
    out.flush();
    log.debug("Wrote {} slides as JSON", presentation.slides().size());
  }

  private void writeTemplate(JsonGenerator json, TemplateMapping mapping) throws IOException {
    json.writeArrayFieldStart("layouts");
    for (LayoutDef layout : mapping.layouts()) {
      json.writeStartObject();
      json.writeStringField("name", layout.name());
      json.writeNumberField("index", layout.index());
      json.writeObjectFieldStart("placeholders");
      for (Map.Entry<String, Integer> placeholder : layout.placeholders().entrySet()) {
        json.writeNumberField(placeholder.getKey(), placeholder.getValue());
      }
      json.writeEndObject();
      json.writeEndObject();
    }
    json.writeEndArray();
  }

  private void writeSlide(JsonGenerator json, SlideNode slide) throws IOException {
    json.writeStartObject();
    json.writeNumberField("index", slide.index());
    json.writeStringField("layout", slide.layout().name());
    json.writeNumberField("layoutIndex", slide.layout().index());
    if (slide.label() != null) {
      json.writeStringField("label", slide.label());
    }
    json.writeArrayFieldStart("placeholders");
    for (PlaceholderNode placeholder : slide.placeholders()) {
      writePlaceholder(json, placeholder);
    }
    json.writeEndArray();
    json.writeEndObject();
  }

  private void writePlaceholder(JsonGenerator json, PlaceholderNode placeholder)
      throws IOException {
    json.writeStartObject();
    json.writeStringField("name", placeholder.name());
    json.writeNumberField("index", placeholder.index());
    json.writeStringField("kind", placeholder.kind().elementName());
    json.writeFieldName("content");
    switch (placeholder.kind()) {
      case TEXT -> writeRun(json, ((TextContent) placeholder.content()).run());
      case IMAGE -> json.writeString(((ImageContent) placeholder.content()).path());
      case TABLE -> writeTable(json, (TableContent) placeholder.content());
      case LIST -> writeList(json, (ListContent) placeholder.content());
    }
    json.writeEndObject();
  }

  private void writeTable(JsonGenerator json, TableContent table) throws IOException {
    TableSpec spec = table.spec();
    TableLayout layout = table.layout();
    json.writeStartObject();
    writeNumbers(json, "columnFractions", layout.columnFractions());
    json.writeStringField("rowMode", spec.rowMode().name());
    writeNumbers(json, "rowFractions", layout.rowFractions());
    json.writeBooleanField("minimumRowHeight", layout.minimumRowHeight());
    json.writeArrayFieldStart("rows");
    for (int r = 0; r < spec.rowCount(); r++) {
      json.writeStartArray();
      for (int c = 0; c < spec.columnCount(); c++) {
        writeRun(json, spec.cell(r, c));
      }
      json.writeEndArray();
    }
    json.writeEndArray();
    json.writeEndObject();
  }

  private void writeList(JsonGenerator json, ListContent list) throws IOException {
    json.writeStartArray();
    Iterator<ListEntry> entries = list.entries().iterator();
    while (entries.hasNext()) {
      ListEntry entry = entries.next();
      json.writeStartObject();
      json.writeNumberField("depth", entry.depth());
      json.writeFieldName("run");
      writeRun(json, entry.run());
      json.writeEndObject();
    }
    json.writeEndArray();
  }

  private void writeRun(JsonGenerator json, TextRun run) throws IOException {
    json.writeStartArray();
    for (TextSpan span : run.spans()) {
      json.writeStartObject();
      if (span instanceof LiteralSpan literal) {
        json.writeStringField("type", "text");
        json.writeStringField("text", literal.text());
      } else if (span instanceof DateSpan date) {
        json.writeStringField("type", "date");
        json.writeStringField("pattern", date.pattern());
      } else if (span instanceof LinkSpan link) {
        writeLink(json, link);
      }
      json.writeEndObject();
    }
    json.writeEndArray();
  }

  private void writeLink(JsonGenerator json, LinkSpan link) throws IOException {
    json.writeStringField("type", "link");
    json.writeStringField("text", link.text());
    if (link.isSymbolic()) {
      json.writeStringField("ref", link.label());
      if (link.targetSlide().isPresent()) {
        json.writeNumberField("slide", link.targetSlide().getAsInt());
      }
    } else {
      json.writeStringField("addr", link.address());
    }
  }

  private static void writeNumbers(JsonGenerator json, String field, List<Double> values)
      throws IOException {
    json.writeArrayFieldStart(field);
    for (double value : values) {
      json.writeNumber(value);
    }
    json.writeEndArray();
  }
}
