package sjtu.sdic.ehr.common;

/**
 * Runtime settings, bound from the {@code mr.} keys of application.properties.
 * Fields keep their defaults when a key is absent.
 *
 * Created by Cachhe on 2019/5/1.
 */
public class MRConfig {
    /**
     * config key prefix
     */
    public static final String PREFIX = "mr";

    private String serverHost = "127.0.0.1";

    private int serverPort = 12200;

    /**
     * unique id of the master's RPC service
     */
    private String address = "master";

    private String inputDir = ".";

    /**
     * wildcard matched against names in inputDir
     */
    private String inputPattern = "*.txt";

    /**
     * intermediate files and the report go here
     */
    private String workDir = "mr-tmp";

    private String outputFile = "reduce-out.txt";

    private int nReduce = 1;

    private boolean debug = false;

    private static volatile MRConfig mrConfig;

    /**
     * @return the settings loaded once from application.properties
     */
    public static MRConfig getConfig() {
        if (mrConfig == null) {
            synchronized (MRConfig.class) {
                if (mrConfig == null) {
                    mrConfig = ConfigUtils.loadConfig(MRConfig.class, PREFIX);
                }
            }
        }
        return mrConfig;
    }

    public String getServerHost() {
        return serverHost;
    }

    public void setServerHost(String serverHost) {
        this.serverHost = serverHost;
    }

    public int getServerPort() {
        return serverPort;
    }

    public void setServerPort(int serverPort) {
        this.serverPort = serverPort;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(String inputDir) {
        this.inputDir = inputDir;
    }

    public String getInputPattern() {
        return inputPattern;
    }

    public void setInputPattern(String inputPattern) {
        this.inputPattern = inputPattern;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public int getNReduce() {
        return nReduce;
    }

    public void setNReduce(int nReduce) {
        this.nReduce = nReduce;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    @Override
    public String toString() {
        return String.format("MRConfig{server=%s:%d, address=%s, input=%s/%s, workDir=%s, outputFile=%s, nReduce=%d, debug=%b}",
                serverHost, serverPort, address, inputDir, inputPattern, workDir, outputFile, nReduce, debug);
    }
}
