package sjtu.sdic.ehr.common;

import java.util.Objects;

/**
 * One health record, i.e. one line of an input partition.
 *
 * Created by Cachhe on 2019/5/2.
 */
public class Record {
    public final String patientId;
    public final String name; // first and last name joined by a single space
    public final String age;
    public final String diagnosis;
    public final String treatment;

    public Record(String patientId, String name, String age, String diagnosis, String treatment) {
        this.patientId = patientId;
        this.name = name;
        this.age = age;
        this.diagnosis = diagnosis;
        this.treatment = treatment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Record))
            return false;
        Record r = (Record) o;
        return patientId.equals(r.patientId) && name.equals(r.name) && age.equals(r.age)
                && diagnosis.equals(r.diagnosis) && treatment.equals(r.treatment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patientId, name, age, diagnosis, treatment);
    }

    @Override
    public String toString() {
        return String.format("Record{%s, %s, %s, %s, %s}", patientId, name, age, diagnosis, treatment);
    }
}
