package com.zplat.ipld.mapper;

import com.zplat.ipld.dto.LparSnapshot;
import com.zplat.ipld.entity.LparTarget;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface LparTargetMapper {
    LparSnapshot toSnapshot(LparTarget target);

    List<LparSnapshot> toSnapshots(List<LparTarget> targets);
}
