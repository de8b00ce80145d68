package com.programmewatch.watcher.application.controller.mapper;

import com.programmewatch.watcher.application.controller.delivery.DeliveryRecordResponse;
import com.programmewatch.watcher.application.controller.market.ChangeResponse;
import com.programmewatch.watcher.application.controller.market.CycleReportResponse;
import com.programmewatch.watcher.application.controller.market.MarketStatusResponse;
import com.programmewatch.watcher.domain.alert.DeliveryRecord;
import com.programmewatch.watcher.domain.change.Change;
import com.programmewatch.watcher.domain.cycle.CycleReport;
import com.programmewatch.watcher.domain.cycle.MarketStatus;
import com.programmewatch.watcher.domain.programme.ProgrammeId;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface WatcherResponseMapper {

    MarketStatusResponse toResponse(MarketStatus status);

    CycleReportResponse toResponse(CycleReport report);

    ChangeResponse toResponse(Change change);

    @Mapping(target = "marketKey", source = "change.marketKey")
    @Mapping(target = "programmeId", source = "change.programmeId")
    @Mapping(target = "programmeName", source = "change.programmeName")
    @Mapping(target = "kind", source = "change.kind")
    DeliveryRecordResponse toResponse(DeliveryRecord record);

    default String toValue(ProgrammeId programmeId) {
        return programmeId == null ? null : programmeId.value();
    }
}
