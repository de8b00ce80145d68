package com.programmewatch.watcher.application.controller;

import com.programmewatch.watcher.application.controller.delivery.DeliveryController;
import com.programmewatch.watcher.application.controller.mapper.WatcherResponseMapper;
import com.programmewatch.watcher.application.controller.market.MarketController;
import com.programmewatch.watcher.application.scheduler.PollScheduler;
import com.programmewatch.watcher.domain.alert.DeliveryLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
public abstract class ControllerBaseTest {

    static final String MARKETS_PATH = "/api/v1/markets";
    static final String DELIVERIES_PATH = "/api/v1/deliveries";

    @Mock
    PollScheduler pollScheduler;

    DeliveryLog deliveryLog;
    MockMvc mockMvc;

    @BeforeEach
    void setUpMockMvc() {
        deliveryLog = new DeliveryLog(100);
        var mapper = Mappers.getMapper(WatcherResponseMapper.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new MarketController(pollScheduler, mapper), new DeliveryController(deliveryLog, mapper))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }
}
