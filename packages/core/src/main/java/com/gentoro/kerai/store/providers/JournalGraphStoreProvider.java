package com.gentoro.kerai.store.providers;

import com.gentoro.kerai.store.GraphStore;
import com.gentoro.kerai.store.journal.JournalGraphStore;
import com.gentoro.kerai.store.spi.GraphStoreProvider;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the JSON-lines journal store. */
public class JournalGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "journal";
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    String path = configuration.getString("kerai.store.journal.path", null);
    return path != null && !path.isBlank();
  }

  @Override
  public GraphStore create(Configuration configuration) {
    return new JournalGraphStore(Path.of(configuration.getString("kerai.store.journal.path")));
  }
}
