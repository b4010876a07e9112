package sjtu.sdic.ehr.common;

/**
 * The record fields a run counts. Each one gets its own intermediate file per
 * map task and its own section in the report.
 *
 * Created by Cachhe on 2019/5/2.
 */
public enum Category {
    DIAGNOSIS("diagnosis", "Diagnosis Counts:"),
    TREATMENT("treatment", "Treatment Counts:");

    private final String key;
    private final String header;

    Category(String key, String header) {
        this.key = key;
        this.header = header;
    }

    public String key() {
        return key;
    }

    public String header() {
        return header;
    }

    public String valueOf(Record record) {
        return this == DIAGNOSIS ? record.diagnosis : record.treatment;
    }
}
