package com.namekis.gitfleet.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Everything one machine knows about its catalogs and the repositories observed in them. */
public class MachineSnapshot {
  public String machineId = "";
  public String hostname = "";
  public String defaultCatalog = "";
  public List<Catalog> catalogs = new ArrayList<>();
  public Instant lastScanAt;
  public List<String> lastScanCatalogs = new ArrayList<>();
  public Instant updatedAt;
  public List<RepositoryRecord> repos = new ArrayList<>();

  /** All catalogs when {@code include} is empty, otherwise the named ones in request order without duplicates. */
  public List<Catalog> selectCatalogs(List<String> include) {
    if (include == null || include.isEmpty()) {
      return new ArrayList<>(catalogs);
    }
    Map<String, Catalog> selected = new LinkedHashMap<>();
    for (String name : include) {
      if (selected.containsKey(name)) {
        continue;
      }
      selected.put(name, findCatalog(name).orElseThrow(() -> new IllegalArgumentException("invalid catalog \"%s\"".formatted(name))));
    }
    return new ArrayList<>(selected.values());
  }

  public Optional<Catalog> findCatalog(String name) {
    return catalogs.stream().filter(c -> c.name.equals(name)).findFirst();
  }

  /** @return index of the record living at the given path, or -1 */
  public int indexOfPath(String path) {
    Path wanted = Path.of(path).normalize();
    for (int i = 0; i < repos.size(); i++) {
      if (Path.of(repos.get(i).path).normalize().equals(wanted)) {
        return i;
      }
    }
    return -1;
  }

  /** Replaces the record at the same path or appends it, then re-sorts. */
  public void upsertRecord(RepositoryRecord record) {
    int index = indexOfPath(record.path);
    if (index >= 0) {
      repos.set(index, record);
    } else {
      repos.add(record);
    }
    repos.sort(RepositoryRecord.FIX_ORDER);
  }
}
