package sjtu.sdic.ehr.common;

/**
 * Created by Cachhe on 2019/4/19.
 */
public enum JobPhase {
    MAP_PHASE("map"),
    REDUCE_PHASE("reduce");

    private final String kind;

    JobPhase(String kind) {
        this.kind = kind;
    }

    /**
     * @return "map" or "reduce"
     */
    public String kind() {
        return kind;
    }
}
