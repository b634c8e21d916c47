package com.example.pbirest.core.refresh;

import com.example.pbirest.core.resources.RefreshRecord;
import java.util.Optional;

/** Where a refreshable resource stands, derived from its latest history entry. */
public enum RefreshState {
  NO_HISTORY,
  IN_PROGRESS,
  TERMINAL;

  public static RefreshState of(final Optional<RefreshRecord> last) {
    return last.map(record -> record.isInProgress() ? IN_PROGRESS : TERMINAL).orElse(NO_HISTORY);
  }
}
