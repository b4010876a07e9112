package sjtu.sdic.ehr.common;

import org.apache.commons.io.FilenameUtils;

import java.nio.file.Paths;

/**
 * Created by Cachhe on 2019/4/19.
 */
public class Utils {
    public static volatile boolean debugEnabled = false;

    public static void debug(String msg) {
        if (debugEnabled)
            System.out.println(msg);
    }

    /**
     * intermediateName constructs the name of the intermediate file which map task
     * <mapTask> produces for one category of its input partition.
     *
     * @param workDir directory holding the exchange files
     * @param category diagnosis or treatment
     * @param partition input partition, only its base name is used
     * @param mapTask map task id
     * @return path of the intermediate file
     */
    public static String intermediateName(String workDir, Category category, String partition, int mapTask) {
        String name = "map-" + category.key() + "-" + FilenameUtils.getName(partition) + "-" + mapTask + ".txt";
        return Paths.get(workDir, name).toString();
    }

    /**
     * reportName constructs the name of the output file of reduce task <reduceTask>.
     * Reduce task 0 owns the configured name itself.
     *
     * @param workDir directory holding the report
     * @param outputFile configured report name
     * @param reduceTask reduce task id
     * @return path of the report
     */
    public static String reportName(String workDir, String outputFile, int reduceTask) {
        if (reduceTask == 0)
            return Paths.get(workDir, outputFile).toString();

        String ext = FilenameUtils.getExtension(outputFile);
        String base = FilenameUtils.removeExtension(outputFile);
        String name = ext.isEmpty() ? base + "-" + reduceTask : base + "-" + reduceTask + "." + ext;
        return Paths.get(workDir, name).toString();
    }
}
