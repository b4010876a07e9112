package sjtu.sdic.ehr.common;

/**
 * Thrown when an input line does not carry the six positional fields of a record.
 *
 * Created by Cachhe on 2019/5/2.
 */
public class MalformedRecordException extends MapReduceException {
    private final String line;

    public MalformedRecordException(String line, int tokens) {
        super(String.format("malformed record, expected 6 fields but got %d: \"%s\"", tokens, line));
        this.line = line;
    }

    public String getLine() {
        return line;
    }
}
