package sjtu.sdic.ehr.core;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import sjtu.sdic.ehr.common.Category;
import sjtu.sdic.ehr.common.RunConfig;
import sjtu.sdic.ehr.common.Utils;

/** Created by Cachhe on 2019/4/19. */
public class Reducer {

  /**
   * doReduce manages one reduce task: it reads the diagnosis and the treatment intermediate file
   * of every map task, 0 to {@code nMap - 1}, sums the counts per value and writes the report.
   *
   * <p>A missing or unreadable intermediate file fails the task. There is no partial aggregation:
   * without one of the files the totals would be wrong, so no report is written at all.
   *
   * <p>The report has a "Diagnosis Counts:" section then a "Treatment Counts:" section, each
   * followed by one {@code value count} line per value, sorted by value. It is written to a
   * temporary file first and moved into place, so readers never see half a report.
   *
   * @param conf the run this task belongs to
   * @param reduceTask which reduce task this is
   * @param nMap the number of map tasks that were run ("M" in the paper)
   * @throws IOException if an intermediate file can't be read or the report can't be written
   */
  public static void doReduce(RunConfig conf, int reduceTask, int nMap) throws IOException {
    final Map<Category, Map<String, Long>> totals = new EnumMap<>(Category.class);
    for (Category c : Category.values()) {
      totals.put(c, new TreeMap<>());
    }

    for (int i = 0; i < nMap; i++) {
      for (Category c : Category.values()) {
        final String inFile = conf.intermediateName(c, i);
        Utils.debug(String.format("Reduce: task #%d read %s", reduceTask, inFile));
        IntermediateStore.readInto(inFile, totals.get(c));
      }
    }

    final Path outFile = Paths.get(conf.reportName(reduceTask));
    final Path tmp = Files.createTempFile(outFile.toAbsolutePath().getParent(), "reduce-tmp-", ".txt");
    try {
      try (BufferedWriter bw = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        for (Category c : Category.values()) {
          bw.write(c.header());
          bw.newLine();
          for (Map.Entry<String, Long> e : totals.get(c).entrySet()) {
            bw.write(e.getKey() + " " + e.getValue());
            bw.newLine();
          }
        }
      }
      Files.move(tmp, outFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }
}
