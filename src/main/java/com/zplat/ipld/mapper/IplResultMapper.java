package com.zplat.ipld.mapper;

import com.zplat.ipld.dto.response.IplResultResponse;
import com.zplat.ipld.dto.response.LastIplResponse;
import com.zplat.ipld.entity.ResultDone;
import com.zplat.ipld.entity.ResultFail;
import com.zplat.ipld.entity.ResultLastIpl;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface IplResultMapper {

    IplResultResponse toResponse(ResultDone done);

    // fail rows carry no computed columns
    @Mapping(target = "iplDate", ignore = true)
    @Mapping(target = "shutdownDuration", ignore = true)
    @Mapping(target = "poweroffDuration", ignore = true)
    @Mapping(target = "loadIpl", ignore = true)
    @Mapping(target = "totalDuration", ignore = true)
    IplResultResponse toResponse(ResultFail fail);

    LastIplResponse toResponse(ResultLastIpl lastIpl);

    List<IplResultResponse> toDoneResponses(List<ResultDone> rows);

    List<IplResultResponse> toFailResponses(List<ResultFail> rows);

    List<LastIplResponse> toLastIplResponses(List<ResultLastIpl> rows);
}
