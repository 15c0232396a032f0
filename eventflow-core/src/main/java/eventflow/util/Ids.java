package eventflow.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation.
 *
 * <p>Ids are monotonic ULIDs rendered in UUID form: globally unique, and ordered by
 * creation time even within the same millisecond of one JVM.
 */
public final class Ids {

    private Ids() {
    }

    public static String newEventId() {
        return UlidCreator.getMonotonicUlid().toUuid().toString();
    }

    public static String newSagaId() {
        return UlidCreator.getMonotonicUlid().toUuid().toString();
    }
}
