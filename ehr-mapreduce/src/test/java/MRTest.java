import junit.framework.TestCase;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import sjtu.sdic.ehr.EhrCount;
import sjtu.sdic.ehr.common.Category;
import sjtu.sdic.ehr.common.JobPhase;
import sjtu.sdic.ehr.common.MRConfig;
import sjtu.sdic.ehr.common.MalformedRecordException;
import sjtu.sdic.ehr.common.MapReduceException;
import sjtu.sdic.ehr.common.MasterState;
import sjtu.sdic.ehr.common.RunConfig;
import sjtu.sdic.ehr.common.Utils;
import sjtu.sdic.ehr.core.Master;
import sjtu.sdic.ehr.core.Scheduler;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * End to end runs: real partitions on disk, both phases, done over RPC.
 *
 * Created by Cachhe on 2019/4/19.
 */
public class MRTest {
    public static final int PORT = 12211;
    public static final String[] DIAGNOSES = {"flu", "cold", "asthma", "migraine", "fracture"};
    public static final String[] TREATMENTS = {"rest", "tamiflu", "inhaler", "cast", "tea"};

    private static final AtomicInteger SEQ = new AtomicInteger();

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private File inputDir;
    private File workDir;

    @Before
    public void setUp() throws IOException {
        inputDir = tmp.newFolder("input");
        workDir = new File(tmp.getRoot(), "work");
    }

    public String makeInput(String name, String... lines) {
        File file = new File(inputDir, name);
        try (BufferedWriter bw = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            for (String line : lines) {
                bw.write(line);
                bw.newLine();
            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return file.getPath();
    }

    public MRConfig config(int nReduce) {
        MRConfig config = new MRConfig();
        config.setServerPort(PORT);
        config.setAddress("test-" + SEQ.incrementAndGet());
        config.setWorkDir(workDir.getPath());
        config.setNReduce(nReduce);
        return config;
    }

    public Master setup(List<String> files, int nReduce) {
        MRConfig config = config(nReduce);
        return Master.makeMaster(RunConfig.of(files, config), config);
    }

    /**
     * parse a report into its two sections, value -> count
     */
    public Map<String, Map<String, Long>> readReport(String report) throws IOException {
        Map<String, Map<String, Long>> sections = new LinkedHashMap<>();
        Map<String, Long> current = null;
        for (String line : Files.readAllLines(new File(report).toPath(), StandardCharsets.UTF_8)) {
            if (line.endsWith(":")) {
                current = new HashMap<>();
                sections.put(line, current);
                continue;
            }
            TestCase.assertNotNull("count line before any section: " + line, current);
            String[] kv = line.split(" ");
            TestCase.assertEquals(line, 2, kv.length);
            TestCase.assertNull("value listed twice: " + kv[0], current.put(kv[0], Long.parseLong(kv[1])));
        }
        return sections;
    }

    public void cleanup(Master mr) {
        if (mr == null)
            return;

        mr.shutdown();
        mr.cleanupFiles();
    }

    @Test
    public void testTwoPartitions() throws IOException {
        String a = makeInput("a.txt",
                "P1 Ann Lee 30 flu rest",
                "P2 Bob Ray 41 flu tamiflu",
                "P3 Cat Poe 25 cold rest");
        String b = makeInput("b.txt",
                "P4 Dan Orr 52 flu tamiflu",
                "P5 Eve Fox 19 cold tea",
                "P6 Fay Gil 66 cold rest");
        Master mr = null;
        try {
            mr = setup(Arrays.asList(a, b), 1);
            mr.parallel();

            Map<String, Map<String, Long>> report = readReport(mr.conf.reportName(0));
            TestCase.assertEquals(Arrays.asList("Diagnosis Counts:", "Treatment Counts:"), new ArrayList<>(report.keySet()));

            Map<String, Long> diagnoses = report.get("Diagnosis Counts:");
            TestCase.assertEquals(2, diagnoses.size());
            TestCase.assertEquals(3, (long) diagnoses.get("flu"));
            TestCase.assertEquals(3, (long) diagnoses.get("cold"));

            Map<String, Long> treatments = report.get("Treatment Counts:");
            TestCase.assertEquals(3, (long) treatments.get("rest"));
            TestCase.assertEquals(2, (long) treatments.get("tamiflu"));
            TestCase.assertEquals(1, (long) treatments.get("tea"));

            TestCase.assertEquals(MasterState.COMPLETED, mr.getState());
            TestCase.assertTrue(mr.mWait(0, TimeUnit.MILLISECONDS));
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testMalformedRecordAbortsRun() {
        String a = makeInput("a.txt", "P1 Ann Lee 30 flu rest");
        String b = makeInput("b.txt", "P2 Bob Ray 41");
        Master mr = null;
        try {
            mr = setup(Arrays.asList(a, b), 1);
            try {
                mr.parallel();
                TestCase.fail("run must abort on a malformed record");
            } catch (MapReduceException e) {
                TestCase.assertTrue("cause was " + e.getCause(), e.getCause() instanceof MalformedRecordException);
                TestCase.assertTrue(e.getMessage(), e.getMessage().contains("MAP_PHASE task #1"));
            }
            TestCase.assertFalse("no report after a failed map phase", new File(mr.conf.reportName(0)).exists());
            TestCase.assertFalse("done must not be signaled", mr.mWait(100, TimeUnit.MILLISECONDS));
            TestCase.assertEquals(MasterState.INITIALIZED, mr.getState());
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testMissingIntermediateFailsReduce() {
        String a = makeInput("a.txt", "P1 Ann Lee 30 flu rest");
        String b = makeInput("b.txt", "P2 Bob Ray 41 cold tea");
        Master mr = null;
        try {
            mr = setup(Arrays.asList(a, b), 1);
            final Master master = mr;
            try {
                // housekeeping gone wrong: a shard disappears between the phases
                mr.run(jobPhase -> {
                    Scheduler.schedule(master.conf, jobPhase);
                    if (jobPhase == JobPhase.MAP_PHASE) {
                        master.removeFile(master.conf.intermediateName(Category.DIAGNOSIS, 1));
                    }
                    return null;
                }, aVoid -> {
                    master.notifyDone();
                    return null;
                });
                TestCase.fail("run must abort when an intermediate file is missing");
            } catch (MapReduceException e) {
                TestCase.assertTrue("cause was " + e.getCause(), e.getCause() instanceof NoSuchFileException);
                TestCase.assertTrue(e.getMessage(), e.getMessage().contains("REDUCE_PHASE"));
            }
            TestCase.assertFalse("no report after a failed reduce phase", new File(mr.conf.reportName(0)).exists());
            TestCase.assertFalse(mr.mWait(100, TimeUnit.MILLISECONDS));
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testMissingPartitionAbortsRun() {
        String a = makeInput("a.txt", "P1 Ann Lee 30 flu rest");
        String gone = new File(inputDir, "gone.txt").getPath();
        Master mr = null;
        try {
            mr = setup(Arrays.asList(a, gone), 1);
            try {
                mr.sequential();
                TestCase.fail();
            } catch (MapReduceException e) {
                TestCase.assertTrue(e.getCause() instanceof IOException);
            }
            TestCase.assertFalse(new File(mr.conf.reportName(0)).exists());
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testStaleReportRemoved() throws IOException {
        String a = makeInput("a.txt", "P1 Ann Lee 30");
        Master mr = null;
        try {
            mr = setup(Arrays.asList(a), 1);
            File report = new File(mr.conf.reportName(0));
            TestCase.assertTrue(workDir.mkdirs());
            Files.write(report.toPath(), Arrays.asList("Diagnosis Counts:", "flu 99"), StandardCharsets.UTF_8);
            try {
                mr.parallel();
                TestCase.fail();
            } catch (MapReduceException expected) {
                TestCase.assertFalse("an old report must not survive a failed run", report.exists());
            }
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testGlobalAggregation() throws IOException {
        Random random = new Random(824);
        Map<String, Long> expectDiagnoses = new HashMap<>();
        Map<String, Long> expectTreatments = new HashMap<>();
        List<String> files = new ArrayList<>();
        int id = 0;
        for (int p = 0; p < 8; p++) {
            String[] lines = new String[50 + random.nextInt(200)];
            for (int i = 0; i < lines.length; i++) {
                String d = DIAGNOSES[random.nextInt(DIAGNOSES.length)];
                String t = TREATMENTS[random.nextInt(TREATMENTS.length)];
                lines[i] = String.format("P%d First Last %d %s %s", id++, 20 + random.nextInt(60), d, t);
                expectDiagnoses.merge(d, 1L, Long::sum);
                expectTreatments.merge(t, 1L, Long::sum);
            }
            files.add(makeInput(String.format("part-%d.txt", p), lines));
        }

        Master mr = null;
        try {
            mr = setup(files, 1);
            mr.parallel();
            Map<String, Map<String, Long>> report = readReport(mr.conf.reportName(0));
            TestCase.assertEquals(expectDiagnoses, report.get("Diagnosis Counts:"));
            TestCase.assertEquals(expectTreatments, report.get("Treatment Counts:"));
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testSequentialMatchesParallel() throws IOException {
        List<String> files = Arrays.asList(
                makeInput("a.txt", "P1 Ann Lee 30 flu rest", "P2 Bob Ray 41 migraine tea"),
                makeInput("b.txt", "P3 Cat Poe 25 asthma inhaler"),
                makeInput("c.txt", "P4 Dan Orr 52 flu rest", "P5 Eve Fox 19 flu tamiflu"));

        Master seq = null;
        Master par = null;
        try {
            seq = setup(files, 1);
            seq.sequential();
            List<String> sequential = Files.readAllLines(new File(seq.conf.reportName(0)).toPath());
            seq.shutdown();

            par = setup(files, 1);
            par.parallel();
            List<String> parallel = Files.readAllLines(new File(par.conf.reportName(0)).toPath());

            TestCase.assertEquals(sequential, parallel);
        } finally {
            cleanup(seq);
            cleanup(par);
        }
    }

    @Test
    public void testMultipleReducers() throws IOException {
        List<String> files = Arrays.asList(
                makeInput("a.txt", "P1 Ann Lee 30 flu rest"),
                makeInput("b.txt", "P2 Bob Ray 41 cold tea"));
        Master mr = null;
        try {
            mr = setup(files, 2);
            mr.parallel();
            File first = new File(workDir, "reduce-out.txt");
            File second = new File(workDir, "reduce-out-1.txt");
            TestCase.assertEquals(readReport(first.getPath()), readReport(second.getPath()));
            TestCase.assertEquals(2, mr.getReduceTasks().size());
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testLocalRunDoesNotLease() {
        List<String> files = Arrays.asList(
                makeInput("a.txt", "P1 Ann Lee 30 flu rest"),
                makeInput("b.txt", "P2 Bob Ray 41 cold tea"));
        Master mr = null;
        try {
            mr = setup(files, 1);
            mr.parallel();
            // tasks run in-process, the lease pools are for out-of-process workers
            TestCase.assertEquals(2, mr.getMapTasks().remaining());
            TestCase.assertEquals(1, mr.getReduceTasks().remaining());
            TestCase.assertEquals(0, mr.assignMapTask(0));
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testCleanupFiles() {
        List<String> files = Arrays.asList(makeInput("a.txt", "P1 Ann Lee 30 flu rest"));
        Master mr = null;
        try {
            mr = setup(files, 1);
            mr.parallel();
            TestCase.assertEquals(3, workDir.list().length);
            mr.cleanupFiles();
            TestCase.assertEquals(0, workDir.list().length);
        } finally {
            cleanup(mr);
        }
    }

    @Test
    public void testListInputs() {
        makeInput("b.txt", "x");
        makeInput("a.txt", "x");
        makeInput("notes.md", "x");
        List<String> inputs = EhrCount.listInputs(inputDir.getPath(), "*.txt");
        TestCase.assertEquals(Arrays.asList(
                new File(inputDir, "a.txt").getPath(),
                new File(inputDir, "b.txt").getPath()), inputs);
        TestCase.assertTrue(EhrCount.listInputs(new File(tmp.getRoot(), "nowhere").getPath(), "*.txt").isEmpty());
    }

    @Test
    public void testIntermediateNaming() {
        TestCase.assertEquals(new File("w", "map-diagnosis-a.txt-0.txt").getPath(),
                Utils.intermediateName("w", Category.DIAGNOSIS, "in/a.txt", 0));
    }
}
