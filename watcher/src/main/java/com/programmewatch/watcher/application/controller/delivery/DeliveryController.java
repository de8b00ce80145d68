package com.programmewatch.watcher.application.controller.delivery;

import com.programmewatch.watcher.application.controller.mapper.WatcherResponseMapper;
import com.programmewatch.watcher.domain.alert.DeliveryLog;
import com.programmewatch.watcher.domain.alert.DeliveryStatus;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/deliveries")
@RequiredArgsConstructor
public class DeliveryController {

    private final DeliveryLog deliveryLog;
    private final WatcherResponseMapper mapper;

    @GetMapping
    public List<DeliveryRecordResponse> listDeliveries(
            @RequestParam(required = false) DeliveryStatus status,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > deliveryLog.capacity()) {
            throw new IllegalArgumentException("limit must be between 1 and " + deliveryLog.capacity());
        }
        return deliveryLog.recent(status, limit).stream().map(mapper::toResponse).toList();
    }
}
