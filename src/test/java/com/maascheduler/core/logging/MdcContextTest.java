package com.maascheduler.core.logging;

import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.TaskFixtures;
import com.maascheduler.core.model.TriggerKey;
import com.maascheduler.core.model.TriggerType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setRun stamps task and run ids")
    void setRun() {
        MdcContext.setRun("daily", "daily-20261019-040000");

        assertEquals("daily", MDC.get(MdcContext.TASK_ID));
        assertEquals("daily-20261019-040000", MDC.get(MdcContext.RUN_ID));
    }

    @Test
    @DisplayName("setItem stamps origin and trigger key")
    void setItem() {
        var item = QueueItem.scheduled(TaskFixtures.task("daily", 1), TriggerKey.of("daily", 1), TriggerType.SCHEDULED);

        MdcContext.setItem(item);

        assertEquals("daily", MDC.get(MdcContext.TASK_ID));
        assertEquals("scheduler", MDC.get(MdcContext.ORIGIN));
        assertEquals("daily:1", MDC.get(MdcContext.TRIGGER_KEY));
    }

    @Test
    @DisplayName("manual items carry no trigger key")
    void manualItem() {
        MdcContext.setItem(QueueItem.manual(TaskFixtures.task("daily", 1)));

        assertEquals("manual", MDC.get(MdcContext.ORIGIN));
        assertNull(MDC.get(MdcContext.TRIGGER_KEY));
    }

    @Test
    @DisplayName("clear removes only scheduler keys")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setRun("daily", "run-1");

        MdcContext.clear();

        assertNull(MDC.get(MdcContext.TASK_ID));
        assertNull(MDC.get(MdcContext.RUN_ID));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
