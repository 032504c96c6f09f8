package com.zplat.ipld.repository;

import com.zplat.ipld.entity.ResultLastIpl;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResultLastIplRepository extends JpaRepository<ResultLastIpl, Long> {
    boolean existsBySysnameAndLastIpl(String sysname, String lastIpl);

    List<ResultLastIpl> findAllByOrderBySysnameAscIdAsc();
}
