package sjtu.sdic.ehr.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import sjtu.sdic.ehr.common.Category;
import sjtu.sdic.ehr.common.Record;
import sjtu.sdic.ehr.common.RunConfig;
import sjtu.sdic.ehr.common.Utils;

/** Created by Cachhe on 2019/4/19. */
public class Mapper {

  /**
   * doMap manages one map task: it reads the input partition {@code inFile} line by line, parses
   * each line into a record and counts records per diagnosis and per treatment. When the whole
   * partition has been read, each table is written to its own intermediate file, named after the
   * partition and {@code mapTask}, so concurrent map tasks never write the same file.
   *
   * <p>Nothing is written if the partition can't be read or holds a malformed line.
   *
   * @param conf the run this task belongs to
   * @param mapTask which map task this is
   * @param inFile input partition
   * @throws IOException if reading the partition or writing an intermediate file fails
   */
  public static void doMap(RunConfig conf, int mapTask, String inFile) throws IOException {
    final Map<Category, Map<String, Long>> counts = new EnumMap<>(Category.class);
    for (Category c : Category.values()) {
      counts.put(c, new HashMap<>());
    }

    int records = 0;
    try (BufferedReader br = Files.newBufferedReader(Paths.get(inFile), StandardCharsets.UTF_8)) {
      String line;
      while ((line = br.readLine()) != null) {
        final Record record = RecordParser.parse(line);
        for (Category c : Category.values()) {
          counts.get(c).merge(c.valueOf(record), 1L, Long::sum);
        }
        records++;
      }
    }

    for (Category c : Category.values()) {
      IntermediateStore.write(conf.intermediateName(c, mapTask), counts.get(c));
    }
    Utils.debug(String.format("Map: task #%d read %d records from %s", mapTask, records, inFile));
  }
}
