package com.example.pbirest.core.resources;

/** A resource whose data can be refreshed on demand: a {@link Dataset} or a {@link Dataflow}. */
public sealed interface Refreshable extends Resource permits Dataset, Dataflow {

  Group group();

  /**
   * Path listing the refresh history of this resource.
   *
   * @return path relative to the API base URL
   */
  String refreshHistoryPath();

  /**
   * Path that starts a refresh when POSTed to.
   *
   * @return path relative to the API base URL
   */
  String startRefreshPath();

  /**
   * Body of the start-refresh request.
   *
   * @param refreshType requested refresh type, ignored where the API has none
   * @return JSON-serializable body
   */
  Object refreshRequestBody(String refreshType);
}
