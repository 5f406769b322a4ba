package com.keystone.auth.repository;

import com.keystone.auth.domain.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RoleRepository extends JpaRepository<Role, UUID> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);

    List<Role> findAllByOrderByNameAsc();

    @Query("SELECT r FROM Role r WHERE :permissionId MEMBER OF r.permissionIds")
    List<Role> findByPermissionId(@Param("permissionId") UUID permissionId);
}
