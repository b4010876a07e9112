package sjtu.sdic.ehr;

import org.apache.commons.io.filefilter.WildcardFileFilter;
import sjtu.sdic.ehr.common.MRConfig;
import sjtu.sdic.ehr.common.MapReduceException;
import sjtu.sdic.ehr.common.RunConfig;
import sjtu.sdic.ehr.common.Utils;
import sjtu.sdic.ehr.core.Master;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Counts diagnoses and treatments over a directory of health record partitions.
 *
 * <p>usage: EhrCount [parallel|sequential] [pattern]
 * <br>the pattern defaults to {@code mr.inputPattern}, matched in {@code mr.inputDir}
 *
 * Created by Cachhe on 2019/4/21.
 */
public class EhrCount {

  /**
   * list the input partitions, sorted by name so task numbers are stable across runs
   *
   * @param dir directory to list
   * @param pattern wildcard, e.g. {@code *.txt}
   * @return paths of the matching files
   */
  public static List<String> listInputs(String dir, String pattern) {
    File d = new File(dir);
    String[] names = d.list(new WildcardFileFilter(pattern));
    List<String> files = new ArrayList<>();
    if (names == null) {
      return files;
    }
    Arrays.sort(names);
    for (String name : names) {
      files.add(new File(d, name).getPath());
    }
    return files;
  }

  public static void main(String[] args) {
    MRConfig config = MRConfig.getConfig();
    Utils.debugEnabled = config.isDebug();
    Utils.debug(config.toString());

    String mode = args.length > 0 ? args[0] : "parallel";
    String src = args.length > 1 ? args[1] : config.getInputPattern();
    if (!mode.equals("parallel") && !mode.equals("sequential")) {
      System.err.println("error: usage: EhrCount [parallel|sequential] [pattern]");
      System.exit(2);
    }

    List<String> files = listInputs(config.getInputDir(), src);
    if (files.isEmpty()) {
      System.err.println(String.format("error: no input matching %s in %s", src, config.getInputDir()));
      System.exit(1);
    }

    Master mr = null;
    int status = 0;
    try {
      mr = Master.makeMaster(RunConfig.of(files, config), config);
      if (mode.equals("sequential")) {
        mr.sequential();
      } else {
        mr.parallel();
      }
    } catch (MapReduceException e) {
      System.err.println("error: " + e.getMessage());
      status = 1;
    } finally {
      if (mr != null) {
        mr.shutdown();
      }
    }
    System.exit(status);
  }
}
