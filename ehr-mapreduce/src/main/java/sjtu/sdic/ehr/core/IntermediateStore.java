package sjtu.sdic.ehr.core;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The exchange format between map and reduce tasks: one {@code value count} line
 * per distinct value. Files are written once by their map task and only read after.
 *
 * Created by Cachhe on 2019/5/2.
 */
public class IntermediateStore {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * write counts to file, replacing it if it exists. Lines follow the
     * iteration order of counts.
     */
    public static void write(String file, Map<String, Long> counts) throws IOException {
        // files are allowed to be overwritten
        try (BufferedWriter bw = Files.newBufferedWriter(Paths.get(file), StandardCharsets.UTF_8)) {
            for (Map.Entry<String, Long> e : counts.entrySet()) {
                bw.write(e.getKey() + " " + e.getValue());
                bw.newLine();
            }
        }
    }

    /**
     * read file and add every count into totals
     *
     * @throws IOException if the file can't be read or a line is not a {@code value count} pair
     *                     with a non-negative count
     */
    public static void readInto(String file, Map<String, Long> totals) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8)) {
            String line;
            int n = 0;
            while ((line = br.readLine()) != null) {
                n++;
                String[] kv = WHITESPACE.split(line.trim());
                if (kv.length != 2)
                    throw new IOException(String.format("%s:%d: expected \"value count\", got \"%s\"", file, n, line));

                long count;
                try {
                    count = Long.parseLong(kv[1]);
                } catch (NumberFormatException e) {
                    throw new IOException(String.format("%s:%d: bad count \"%s\"", file, n, kv[1]), e);
                }
                if (count < 0)
                    throw new IOException(String.format("%s:%d: negative count \"%s\"", file, n, kv[1]));

                try {
                    totals.merge(kv[0], count, Math::addExact);
                } catch (ArithmeticException e) {
                    throw new IOException(String.format("%s:%d: total of \"%s\" overflows", file, n, kv[0]), e);
                }
            }
        }
    }
}
