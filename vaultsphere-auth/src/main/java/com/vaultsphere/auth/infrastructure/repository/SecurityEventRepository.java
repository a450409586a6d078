package com.vaultsphere.auth.infrastructure.repository;

import com.vaultsphere.auth.infrastructure.entity.SecurityEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SecurityEventRepository extends JpaRepository<SecurityEventEntity, Long> {
}
