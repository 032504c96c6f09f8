package com.zplat.ipld.repository;

import com.zplat.ipld.entity.LparTarget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface LparTargetRepository extends JpaRepository<LparTarget, Long> {
    List<LparTarget> findByIdIn(Collection<Long> ids);

    List<LparTarget> findByEnabledTrue();
}
