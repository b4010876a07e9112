package sjtu.sdic.ehr.core;

import sjtu.sdic.ehr.common.MalformedRecordException;
import sjtu.sdic.ehr.common.Record;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one input line into a {@link Record}. Fields are positional:
 * id, first name, last name, age, diagnosis, treatment. Tokens past the sixth are ignored.
 * <p>
 * Any Unicode white space separates fields, no-break space included.
 *
 * Created by Cachhe on 2019/5/2.
 */
public class RecordParser {
    public static final int FIELDS = 6;

    private static final Pattern FIELD = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);

    public static Record parse(String line) {
        List<String> fields = new ArrayList<>(FIELDS);
        Matcher m = FIELD.matcher(line);
        while (m.find()) {
            fields.add(m.group());
        }
        if (fields.size() < FIELDS)
            throw new MalformedRecordException(line, fields.size());

        return new Record(fields.get(0), fields.get(1) + " " + fields.get(2), fields.get(3), fields.get(4), fields.get(5));
    }
}
