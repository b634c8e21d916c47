package com.example.pbirest.core.refresh;

import com.example.pbirest.core.resources.RefreshRecord;
import com.example.pbirest.core.resources.Refreshable;
import java.util.Optional;

/** Result of {@link RefreshOrchestrator#refresh}. */
public sealed interface RefreshOutcome {

  Refreshable resource();

  /**
   * The final history entry of the submitted refresh.
   *
   * @return present only when the caller asked to wait for completion and a refresh was submitted
   */
  Optional<RefreshRecord> completion();

  default boolean submitted() {
    return !(this instanceof SkippedInProgress);
  }

  /** A refresh was submitted; nothing was running. */
  record Started(Refreshable resource, RefreshRecord finalRecord) implements RefreshOutcome {

    @Override
    public Optional<RefreshRecord> completion() {
      return Optional.ofNullable(finalRecord);
    }
  }

  /** Nothing was submitted because {@code running} was in progress and force was off. */
  record SkippedInProgress(Refreshable resource, RefreshRecord running) implements RefreshOutcome {

    @Override
    public Optional<RefreshRecord> completion() {
      return Optional.empty();
    }
  }

  /** {@code cancelled} was cancelled, then a new refresh was submitted. */
  record CancelledAndStarted(
      Refreshable resource, RefreshRecord cancelled, RefreshRecord finalRecord)
      implements RefreshOutcome {

    @Override
    public Optional<RefreshRecord> completion() {
      return Optional.ofNullable(finalRecord);
    }
  }
}
