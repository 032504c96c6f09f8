package com.zplat.ipld.repository;

import com.zplat.ipld.entity.ResultGarbage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResultGarbageRepository extends JpaRepository<ResultGarbage, Long> {
    boolean existsByRowKey(String rowKey);

    List<ResultGarbage> findAllByOrderBySysnameAscIdAsc();
}
