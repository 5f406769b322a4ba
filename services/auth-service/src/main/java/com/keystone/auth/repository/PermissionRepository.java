package com.keystone.auth.repository;

import com.keystone.auth.domain.Permission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findByName(String name);

    boolean existsByName(String name);

    List<Permission> findByIdIn(Collection<UUID> ids);

    List<Permission> findAllByOrderByNameAsc();
}
