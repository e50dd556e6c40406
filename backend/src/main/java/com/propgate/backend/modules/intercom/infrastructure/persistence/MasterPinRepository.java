package com.propgate.backend.modules.intercom.infrastructure.persistence;

import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.MasterPin;

import org.springframework.data.jpa.repository.JpaRepository;

public interface MasterPinRepository extends JpaRepository<MasterPin, Long> {

    Optional<MasterPin> findFirstByAccessPointIdAndActiveTrueOrderByIdDesc(Long accessPointId);

    Optional<MasterPin> findFirstByAccessPointIdOrderByIdDesc(Long accessPointId);
}
