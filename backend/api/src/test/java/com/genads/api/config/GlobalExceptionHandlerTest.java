package com.genads.api.config;

import org.apache.ibatis.exceptions.PersistenceException;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.MyBatisSystemException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    @Test
    void testConnectionFailuresAreStoreUnavailable() {
        assertTrue(GlobalExceptionHandler.isStoreUnavailable(
                new CannotGetJdbcConnectionException("no connection", new SQLException("refused"))));
        assertTrue(GlobalExceptionHandler.isStoreUnavailable(
                new RuntimeException(new SQLTransientConnectionException("pool timeout"))));
    }

    @Test
    void testWrappedConnectionFailureIsStoreUnavailable() {
        PersistenceException persistence = new PersistenceException("Error querying database",
                new CannotGetJdbcConnectionException("no connection", new SQLException("refused")));
        assertTrue(GlobalExceptionHandler.isStoreUnavailable(new MyBatisSystemException(persistence)));
    }

    @Test
    void testOtherDataErrorsAreNotStoreUnavailable() {
        assertFalse(GlobalExceptionHandler.isStoreUnavailable(new DataIntegrityViolationException("duplicate key")));
        assertFalse(GlobalExceptionHandler.isStoreUnavailable(new IllegalStateException("boom")));
    }
}
