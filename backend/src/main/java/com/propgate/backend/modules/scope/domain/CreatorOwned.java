package com.propgate.backend.modules.scope.domain;

/**
 * Row that can be filtered by data-access scope through the id of the user who created it.
 */
public interface CreatorOwned {

    Long getCreatedBy();
}
