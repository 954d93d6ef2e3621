package org.iceforge.pgpulse;

import org.iceforge.pgpulse.pool.ConnectionPool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "pgpulse.connection.jdbc-url-template=jdbc:h2:mem:{database};DB_CLOSE_DELAY=-1",
        "pgpulse.connection.default-database=wiring",
        "pgpulse.pool.connect-attempts=1"
})
@AutoConfigureMockMvc
class PgPulseApplicationTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    ConnectionPool pool;

    @Test
    void executesAgainstTheConfiguredDatabase() throws Exception {
        mvc.perform(post("/api/queries/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\":\"SELECT CAST($1 AS INT) + 40 AS answer\",\"params\":[2]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.columns[0]").value("ANSWER"))
                .andExpect(jsonPath("$.rowCount").value(1))
                .andExpect(jsonPath("$.performanceStats.rowsReturned").value(1));

        assertThat(pool.databases()).contains("wiring");
        assertThat(pool.acquireCount()).isEqualTo(pool.releaseCount());
    }

    @Test
    void unknownColumnMapsTo422() throws Exception {
        mvc.perform(post("/api/queries/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\":\"SELECT no_such_column\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").isNotEmpty());
    }

    @Test
    void poolHealthIsExposed() throws Exception {
        mvc.perform(get("/api/pools/health"))
                .andExpect(status().isOk());
    }
}
