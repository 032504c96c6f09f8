package com.zplat.ipld.repository;

import com.zplat.ipld.entity.ResultFail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResultFailRepository extends JpaRepository<ResultFail, Long> {
    boolean existsByRowKey(String rowKey);

    List<ResultFail> findAllByOrderBySysnameAscIdAsc();
}
