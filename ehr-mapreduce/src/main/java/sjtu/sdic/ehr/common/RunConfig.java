package sjtu.sdic.ehr.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one run needs to know, fixed at startup. There is one map task per
 * input partition.
 *
 * Created by Cachhe on 2019/5/1.
 */
public class RunConfig {
    public final List<String> files;
    public final int nMap;
    public final int nReduce;
    public final String workDir;
    public final String outputFile;

    private RunConfig(List<String> files, int nReduce, String workDir, String outputFile) {
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
        this.nMap = files.size();
        this.nReduce = nReduce;
        this.workDir = workDir;
        this.outputFile = outputFile;
    }

    /**
     * @param files input partitions, task i reads files[i]
     * @param nReduce the number of reduce tasks, at least 1
     * @param workDir where intermediate files and the report go
     * @param outputFile report name inside workDir
     * @return run configuration
     */
    public static RunConfig of(List<String> files, int nReduce, String workDir, String outputFile) {
        if (files == null || files.isEmpty())
            throw new IllegalArgumentException("no input partitions");
        if (nReduce < 1)
            throw new IllegalArgumentException("nReduce must be at least 1, got " + nReduce);
        return new RunConfig(files, nReduce, workDir, outputFile);
    }

    public static RunConfig of(List<String> files, MRConfig config) {
        return of(files, config.getNReduce(), config.getWorkDir(), config.getOutputFile());
    }

    public String intermediateName(Category category, int mapTask) {
        return Utils.intermediateName(workDir, category, files.get(mapTask), mapTask);
    }

    public String reportName(int reduceTask) {
        return Utils.reportName(workDir, outputFile, reduceTask);
    }
}
