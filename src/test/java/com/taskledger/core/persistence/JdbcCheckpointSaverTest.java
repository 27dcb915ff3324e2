package com.taskledger.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class JdbcCheckpointSaverTest {

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private JdbcCheckpointSaver saver;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        saver = new JdbcCheckpointSaver(dataSource, new ObjectMapper());
    }

    @Test
    @DisplayName("put stores the state as JSON under the thread id")
    void putStoresJson() throws Exception {
        var checkpoint = Checkpoint.builder()
                .id("cp-1")
                .state(Map.of("planId", "p1", "batchIndex", 2))
                .nodeId("plan_batch")
                .nextNodeId("__END__")
                .build();
        var config = RunnableConfig.builder().threadId("planner:p1").build();

        var updated = saver.put(config, checkpoint);

        verify(statement).setString(1, "planner:p1");
        verify(statement).setString(2, "cp-1");
        verify(statement).setString(eq(5), argThat(json -> json.contains("\"planId\":\"p1\"")));
        assertEquals("cp-1", updated.checkPointId().orElseThrow());
    }

    @Test
    @DisplayName("get reads the latest checkpoint back")
    void getLatest() throws Exception {
        var resultSet = mock(ResultSet.class);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString("checkpoint_id")).thenReturn("cp-9");
        when(resultSet.getString("node_id")).thenReturn("execute_task");
        when(resultSet.getString("next_node_id")).thenReturn(null);
        when(resultSet.getString("state")).thenReturn("{\"planId\":\"p1\",\"taskIndex\":3}");

        var checkpoint = saver.get(RunnableConfig.builder().threadId("executor:p1").build()).orElseThrow();

        assertEquals("cp-9", checkpoint.getId());
        assertEquals(3, checkpoint.getState().get("taskIndex"));
    }

    @Test
    @DisplayName("database failures surface as store exceptions")
    void failuresPropagate() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("relation does not exist", "42P01"));

        assertThrows(StoreException.class,
                () -> saver.list(RunnableConfig.builder().threadId("planner:p1").build()));
    }
}
