package com.gentoro.kerai.store.journal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.kerai.crdt.Operation;
import com.gentoro.kerai.exception.StoreException;
import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.store.memory.InMemoryGraphStore;
import com.gentoro.kerai.utility.JacksonUtility;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;

/**
 * In-memory graph backed by an append-only JSON-lines journal. Each line holds one batch and is
 * written before the batch is applied, so a batch is either fully durable or absent.
 *
 * <p>On {@link #initialize()} the journal is replayed. A last line that does not parse is the
 * remains of an interrupted write: it is cut off the file so the next batch starts on a fresh
 * line. An unparsable line anywhere else is corruption and fails initialization.
 */
public class JournalGraphStore extends InMemoryGraphStore {
  private static final Logger log = LoggingService.getLogger(JournalGraphStore.class);
  private static final TypeReference<List<Operation>> BATCH = new TypeReference<>() {};

  private final Path journal;
  private boolean initialized;

  public JournalGraphStore(Path journal) {
    this.journal = journal;
  }

  public Path journalPath() {
    return journal;
  }

  @Override
  public synchronized void initialize() {
    if (initialized) return;
    try {
      Path parent = journal.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      if (Files.exists(journal)) replay();
    } catch (IOException e) {
      throw new StoreException("Failed to open journal " + journal, e);
    }
    initialized = true;
    log.info("Journal store ready at {} ({} operations)", journal, operationCount());
  }

  private void replay() throws IOException {
    byte[] data = Files.readAllBytes(journal);
    int lineNo = 0;
    int from = 0;
    long goodEnd = 0;
    boolean newlineAtGoodEnd = true;
    while (from < data.length) {
      int nl = indexOf(data, (byte) '\n', from);
      int to = nl < 0 ? data.length : nl;
      lineNo++;
      String line = new String(data, from, to - from, StandardCharsets.UTF_8);
      if (!line.isBlank()) {
        List<Operation> batch;
        try {
          batch = JacksonUtility.getJsonMapper().readValue(line, BATCH);
        } catch (IOException e) {
          if (!onlyBlankAfter(data, to)) {
            throw new StoreException("Corrupt journal line " + lineNo + " in " + journal, e);
          }
          log.warn("Dropping truncated last line {} of journal {}", lineNo, journal);
          break;
        }
        batch.forEach(state::apply);
      }
      goodEnd = nl < 0 ? to : nl + 1;
      newlineAtGoodEnd = nl >= 0 || line.isEmpty();
      from = to + 1;
    }

    if (goodEnd == data.length && newlineAtGoodEnd) return;
    try (FileChannel channel = FileChannel.open(journal, StandardOpenOption.WRITE)) {
      channel.truncate(goodEnd);
      if (!newlineAtGoodEnd) {
        channel.write(ByteBuffer.wrap(new byte[] {'\n'}), goodEnd);
      }
      channel.force(true);
    }
  }

  private static int indexOf(byte[] data, byte b, int from) {
    for (int i = from; i < data.length; i++) {
      if (data[i] == b) return i;
    }
    return -1;
  }

  private static boolean onlyBlankAfter(byte[] data, int from) {
    for (int i = from; i < data.length; i++) {
      if (!Character.isWhitespace(data[i])) return false;
    }
    return true;
  }

  @Override
  public synchronized int appendOperations(List<Operation> batch) {
    if (!initialized) {
      throw new StoreException("Journal store used before initialize()");
    }
    List<Operation> fresh = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Operation op : batch) {
      if (!state.contains(op.getId()) && seen.add(op.getId())) fresh.add(op);
    }
    if (fresh.isEmpty()) return 0;

    String line = JacksonUtility.toJson(fresh) + "\n";
    try {
      Files.writeString(
          journal,
          line,
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND,
          StandardOpenOption.SYNC);
    } catch (IOException e) {
      throw new StoreException("Failed to append to journal " + journal, e);
    }
    return super.appendOperations(fresh);
  }
}
