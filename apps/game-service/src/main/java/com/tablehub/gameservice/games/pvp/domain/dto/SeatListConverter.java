package com.tablehub.gameservice.games.pvp.domain.dto;

import com.alibaba.fastjson2.JSON;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * 座位列表 <-> JSON。
 * 修改座位时必须整体替换列表（见 PvpRoom#assign），否则脏检查感知不到。
 */
@Converter
public class SeatListConverter implements AttributeConverter<List<SeatAssignment>, String> {

    @Override
    public String convertToDatabaseColumn(List<SeatAssignment> attribute) {
        return JSON.toJSONString(attribute == null ? List.of() : attribute);
    }

    @Override
    public List<SeatAssignment> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(JSON.parseArray(dbData, SeatAssignment.class));
    }
}
