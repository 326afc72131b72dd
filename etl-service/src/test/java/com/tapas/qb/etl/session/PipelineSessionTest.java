package com.tapas.qb.etl.session;

import com.tapas.qb.etl.exception.ConnectionException;
import com.tapas.qb.etl.support.DuckDbTestDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("PipelineSession")
class PipelineSessionTest {

    @Test
    @DisplayName("an unreachable target closes the already open source connection")
    void targetFailureClosesSource() throws SQLException {
        Connection sourceConnection = mock(Connection.class);
        DataSource sourceDataSource = mock(DataSource.class);
        when(sourceDataSource.getConnection()).thenReturn(sourceConnection);
        DataSource targetDataSource = mock(DataSource.class);
        when(targetDataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        var failure = assertThrows(ConnectionException.class,
                () -> PipelineSession.open(sourceDataSource, targetDataSource, 100));

        assertEquals("target", failure.getEndpoint());
        verify(sourceConnection).close();
    }

    @Test
    @DisplayName("an unreachable source never touches the target")
    void sourceFailure() throws SQLException {
        DataSource sourceDataSource = mock(DataSource.class);
        when(sourceDataSource.getConnection()).thenThrow(new SQLException("Connection refused"));
        DataSource targetDataSource = mock(DataSource.class);

        var failure = assertThrows(ConnectionException.class,
                () -> PipelineSession.open(sourceDataSource, targetDataSource, 100));

        assertEquals("source", failure.getEndpoint());
        verifyNoInteractions(targetDataSource);
    }

    @Test
    @DisplayName("close releases both connections")
    void closeReleasesBoth() throws SQLException {
        Connection sourceConnection = mock(Connection.class);
        Connection targetConnection = mock(Connection.class);
        DataSource sourceDataSource = mock(DataSource.class);
        DataSource targetDataSource = mock(DataSource.class);
        when(sourceDataSource.getConnection()).thenReturn(sourceConnection);
        when(targetDataSource.getConnection()).thenReturn(targetConnection);

        PipelineSession.open(sourceDataSource, targetDataSource, 100).close();

        verify(sourceConnection).close();
        verify(targetConnection).close();
    }

    @Test
    @DisplayName("a failing target transaction rolls back all of its writes")
    void targetTransactionRollsBack() throws Exception {
        try (var source = DuckDbTestDatabase.source();
             var warehouse = DuckDbTestDatabase.warehouse();
             var session = PipelineSession.open(source.dataSource(), warehouse.dataSource(), 100)) {

            assertThrows(DataAccessException.class, () -> session.inTargetTransaction(() -> {
                warehouse.jdbc().update("INSERT INTO dim_supplier (supplier_id, supplier_name) VALUES (1, 'Acme')");
                return warehouse.jdbc().update("INSERT INTO dim_supplier (supplier_id, supplier_name) VALUES (1, 'Dup')");
            }));

            assertEquals(0, warehouse.count("dim_supplier"));
        }
    }
}
