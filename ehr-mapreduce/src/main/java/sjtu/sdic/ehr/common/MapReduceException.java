package sjtu.sdic.ehr.common;

/**
 * A failure that aborts the whole run.
 *
 * Created by Cachhe on 2019/4/22.
 */
public class MapReduceException extends RuntimeException {

    public MapReduceException(String message) {
        super(message);
    }

    public MapReduceException(String message, Throwable cause) {
        super(message, cause);
    }
}
