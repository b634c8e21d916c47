package com.example.pbirest.core.resources;

/**
 * A Power BI object with identity.
 *
 * <p>Everything except {@link Group} belongs to a group; {@link #groupId()} is the owner's id for
 * those and the group's own id for a group.
 */
public interface Resource extends Exportable {

  String id();

  String name();

  String groupId();
}
