package io.b2mash.b2b.projecthub.security;

/** A resource with a single owning user, identified by email. */
public interface Owned {

  String getOwnerEmail();
}
