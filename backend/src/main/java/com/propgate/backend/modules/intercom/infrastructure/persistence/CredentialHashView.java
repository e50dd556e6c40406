package com.propgate.backend.modules.intercom.infrastructure.persistence;

/**
 * Id and hash of a credential candidate. Matching reads only this projection so the
 * row can be loaded fresh under a write lock once a hash verifies.
 */
public interface CredentialHashView {

    Long getId();

    String getHash();
}
