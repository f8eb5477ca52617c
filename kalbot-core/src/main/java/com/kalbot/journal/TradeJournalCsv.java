package com.kalbot.journal;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.NonNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CSV codec for the trade journal. The whole file is rewritten on every save through a temp
 * file that replaces the journal in one move.
 */
public final class TradeJournalCsv {

  private final Path path;
  private final ObjectReader reader;
  private final ObjectWriter writer;

  public TradeJournalCsv(@NonNull Path path) {
    this.path = Objects.requireNonNull(path, "path");
    CsvMapper mapper = CsvMapper.builder()
        .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
        .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
    CsvSchema schema = mapper.schemaFor(TradeRecord.class).withHeader();
    this.reader = mapper.readerFor(TradeRecord.class).with(CsvSchema.emptySchema().withHeader());
    this.writer = mapper.writer(schema);
  }

  public Path path() {
    return path;
  }

  public List<TradeRecord> load() {
    if (!Files.exists(path)) {
      return List.of();
    }
    List<TradeRecord> out = new ArrayList<>();
    try (MappingIterator<TradeRecord> it = reader.readValues(path.toFile())) {
      while (it.hasNextValue()) {
        out.add(it.nextValue());
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed reading trade journal path=%s".formatted(path), e);
    }
    return out;
  }

  public void save(List<TradeRecord> trades) {
    if (trades == null || trades.isEmpty()) {
      return;
    }
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
      try {
        writer.writeValue(tmp.toFile(), trades);
        move(tmp);
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed writing trade journal path=%s".formatted(path), e);
    }
  }

  private void move(Path tmp) throws IOException {
    try {
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
