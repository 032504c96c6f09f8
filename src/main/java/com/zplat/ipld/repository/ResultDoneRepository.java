package com.zplat.ipld.repository;

import com.zplat.ipld.entity.ResultDone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResultDoneRepository extends JpaRepository<ResultDone, Long> {
    boolean existsByRowKey(String rowKey);

    List<ResultDone> findAllByOrderBySysnameAscIdAsc();
}
