package com.cloudcrud.aspect;

import com.cloudcrud.exception.NotFoundException;
import com.cloudcrud.model.DataRecord;
import com.cloudcrud.repository.impl.InMemoryDocumentStore;
import com.cloudcrud.service.RecordService;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
public class TimingAspectTest {

    @Autowired
    private TimingAspect timingAspect;

    @Autowired
    private RecordService recordService;

    @Autowired
    private InMemoryDocumentStore store;

    @BeforeEach
    public void setUp() {
        store.clear();
    }

    @Test
    public void testTimedServiceIsProxied() {
        assertNotNull(timingAspect);
        assertTrue(AopUtils.isAopProxy(recordService));
    }

    @Test
    public void testTimedMethodReturnsResult() {
        DataRecord record = recordService.create("Task", Map.of("title", "A"));

        assertNotNull(record.getObjectId());
        assertEquals(1, recordService.count("Task", null));
    }

    @Test
    public void testTimedMethodRethrowsFailure() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> recordService.update("Task", "missing000", Map.of("done", true)));
        assertEquals("Object not found: Task/missing000", e.getMessage());
    }
}
