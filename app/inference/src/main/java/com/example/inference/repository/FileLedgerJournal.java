/*
 * どこで: Inference repository 層
 * 何を: ledger エントリを JSON Lines 形式でファイルへ追記・再生・書き換えする
 * なぜ: 外部ストアなしで再起動後も結合状態を復元できるようにするため
 */
package com.example.inference.repository;

import com.example.inference.config.InferenceLedgerProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(
    name = "inference.ledger.journal-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class FileLedgerJournal implements LedgerJournal {

  private static final Logger logger = LoggerFactory.getLogger(FileLedgerJournal.class);

  private final Path path;
  private final ObjectMapper objectMapper;
  private final Object lock = new Object();
  private BufferedWriter writer;

  public FileLedgerJournal(InferenceLedgerProperties properties, ObjectMapper objectMapper) {
    this.path = Path.of(properties.journalPath());
    this.objectMapper = objectMapper;
  }

  @Override
  public void append(JournalEntry entry) {
    final String line = serialize(entry);
    synchronized (lock) {
      try {
        final BufferedWriter current = openWriter();
        current.write(line);
        current.newLine();
        current.flush();
      } catch (IOException ex) {
        closeWriterQuietly();
        throw new LedgerWriteException("failed to append ledger journal path=" + path, ex);
      }
    }
  }

  @Override
  public int replay(Consumer<JournalEntry> consumer) {
    synchronized (lock) {
      if (!Files.exists(path)) {
        return 0;
      }
      int replayed = 0;
      int skipped = 0;
      try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (line.isBlank()) {
            continue;
          }
          final JournalEntry entry;
          try {
            entry = objectMapper.readValue(line, JournalEntry.class);
          } catch (JsonProcessingException ex) {
            // 途中で切れた最終行などは読み飛ばして残りを復元する
            skipped++;
            logger.warn("ledger journal line skipped path={} reason={}", path, ex.getOriginalMessage());
            continue;
          }
          consumer.accept(entry);
          replayed++;
        }
      } catch (IOException ex) {
        throw new LedgerWriteException("failed to read ledger journal path=" + path, ex);
      }
      logger.info("ledger journal replayed path={} entries={} skipped={}", path, replayed, skipped);
      return replayed;
    }
  }

  @Override
  public void rewrite(Supplier<List<JournalEntry>> snapshot) {
    synchronized (lock) {
      final List<JournalEntry> entries = snapshot.get();
      final Path temp = path.resolveSibling(path.getFileName() + ".tmp");
      try {
        createParentDirectories();
        try (BufferedWriter tempWriter =
            Files.newBufferedWriter(
                temp,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
          for (JournalEntry entry : entries) {
            tempWriter.write(serialize(entry));
            tempWriter.newLine();
          }
        }
        closeWriterQuietly();
        Files.move(
            temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (IOException ex) {
        throw new LedgerWriteException("failed to rewrite ledger journal path=" + path, ex);
      }
      logger.info("ledger journal rewritten path={} entries={}", path, entries.size());
    }
  }

  @PreDestroy
  public void close() {
    synchronized (lock) {
      closeWriterQuietly();
    }
  }

  private BufferedWriter openWriter() throws IOException {
    if (writer == null) {
      createParentDirectories();
      writer =
          Files.newBufferedWriter(
              path,
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE,
              StandardOpenOption.APPEND,
              StandardOpenOption.WRITE);
    }
    return writer;
  }

  private void createParentDirectories() throws IOException {
    final Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }

  private void closeWriterQuietly() {
    if (writer == null) {
      return;
    }
    try {
      writer.close();
    } catch (IOException ex) {
      logger.warn("failed to close ledger journal writer path={}", path, ex);
    } finally {
      writer = null;
    }
  }

  private String serialize(JournalEntry entry) {
    try {
      return objectMapper.writeValueAsString(entry);
    } catch (JsonProcessingException ex) {
      throw new LedgerWriteException("failed to serialize ledger journal entry", ex);
    }
  }
}
