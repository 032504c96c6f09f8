package com.zplat.ipld.repository;

import com.zplat.ipld.entity.RawResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RawResultRepository extends JpaRepository<RawResult, Long> {

    @Query("select distinct r.logDataset from RawResult r where r.logDataset is not null")
    List<String> findDistinctLogDatasets();

    boolean existsBySourceFile(String sourceFile);

    List<RawResult> findBySysnameInOrderByIdAsc(Collection<String> sysnames);
}
