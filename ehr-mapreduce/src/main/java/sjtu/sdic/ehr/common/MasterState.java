package sjtu.sdic.ehr.common;

/**
 * Lifecycle of a master. There is no way back to {@link #INITIALIZED}.
 *
 * Created by Cachhe on 2019/5/3.
 */
public enum MasterState {
    /**
     * pools populated, gate not fired
     */
    INITIALIZED,

    /**
     * at least one lease was attempted
     */
    LEASING,

    /**
     * done was acknowledged, terminal
     */
    COMPLETED
}
