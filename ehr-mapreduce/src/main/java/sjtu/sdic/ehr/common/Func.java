package sjtu.sdic.ehr.common;

/**
 * A function-style interface supporting ONE param, used for the schedule and
 * finish steps of a run. If there's no param or no returned value, use {@link Void}
 *
 * Created by Cachhe on 2019/4/19.
 */
@FunctionalInterface
public interface Func<R, T> {

    /**
     * @param t argument, the phase for schedule steps
     * @return result of this function
     */
    R func(T t);
}
