package microbatch;

import java.util.Objects;

/**
 * A unit of work submitted to a {@link MicroBatcher}.
 *
 * <p>The {@code id} is assigned by the caller and is carried through to the
 * {@link JobResult} returned on submission. The engine does not check ids for
 * uniqueness; two jobs with the same id are processed independently.
 *
 * @param id   caller-assigned identifier
 * @param data payload handed to the {@link JobProcessor}
 * @param <A>  payload type, fixed per engine instance
 */
public record Job<A>(long id, A data) {

  public Job {
    Objects.requireNonNull(data, "data");
  }

  /**
   * Shorthand for {@code new Job<>(id, data)}.
   *
   * @param id   caller-assigned identifier
   * @param data payload
   * @param <A>  payload type
   * @return a new job
   */
  public static <A> Job<A> of(long id, A data) {
    return new Job<>(id, data);
  }
}
