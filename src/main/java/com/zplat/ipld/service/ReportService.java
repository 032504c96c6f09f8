package com.zplat.ipld.service;

import com.zplat.ipld.entity.enumeration.ResultView;
import com.zplat.ipld.mapper.IplResultMapper;
import com.zplat.ipld.repository.ResultDoneRepository;
import com.zplat.ipld.repository.ResultFailRepository;
import com.zplat.ipld.repository.ResultLastIplRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ReportService {

    IngestionClassifierService ingestionClassifierService;
    ResultDoneRepository resultDoneRepository;
    ResultFailRepository resultFailRepository;
    ResultLastIplRepository resultLastIplRepository;
    IplResultMapper iplResultMapper;

    /** Picks up any new result files, then returns the requested view. */
    public List<?> getReport(String view) {
        ResultView resultView = ResultView.fromCode(view);
        Set<String> touched = ingestionClassifierService.ingestAndClassify();
        if (!touched.isEmpty()) {
            log.info("Report {} refreshed with new data for {}", resultView.code(), touched);
        }
        return switch (resultView) {
            case DONE -> iplResultMapper.toDoneResponses(resultDoneRepository.findAllByOrderBySysnameAscIdAsc());
            case FAIL -> iplResultMapper.toFailResponses(resultFailRepository.findAllByOrderBySysnameAscIdAsc());
            case LAST_IPL -> iplResultMapper.toLastIplResponses(resultLastIplRepository.findAllByOrderBySysnameAscIdAsc());
        };
    }

    public Set<String> ingest() {
        return ingestionClassifierService.ingestAndClassify();
    }
}
