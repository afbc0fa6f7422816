package com.invoice.templates.controller;

import com.invoice.templates.TestFixtures;
import com.invoice.templates.exception.StoreEmptyException;
import com.invoice.templates.loader.LoadError;
import com.invoice.templates.loader.TemplateLoader;
import com.invoice.templates.service.TemplateRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class TemplateAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TemplateRegistry registry;

    @SpyBean
    private TemplateLoader loader;

    @Test
    void listsLoadedTemplates() throws Exception {
        mockMvc.perform(get("/api/templates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(4))
                .andExpect(jsonPath("$[?(@.id == 'orange-polska')].name").value("Orange Polska"))
                .andExpect(jsonPath("$[?(@.id == 'orange-polska')].generic").value(false))
                .andExpect(jsonPath("$[?(@.id == 'generic-ro')].locale").value("ro"));
    }

    @Test
    void reloadReportsNewVersion() throws Exception {
        long before = registry.current().getVersion();

        mockMvc.perform(post("/api/templates/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(before + 1))
                .andExpect(jsonPath("$.templateCount").value(4))
                .andExpect(jsonPath("$.errors").isEmpty());

        assertThat(registry.current().getVersion()).isEqualTo(before + 1);
    }

    @Test
    void emptyReloadIsAConflictAndKeepsTheActiveStore() throws Exception {
        long before = registry.current().getVersion();
        doThrow(new StoreEmptyException("No usable templates in 4 source(s), 1 error(s)",
                List.of(new LoadError("custom/broken.yml", "template declares no fields"))))
                .when(loader).load(anyList());

        mockMvc.perform(post("/api/templates/reload"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errors[0]").value("custom/broken.yml: template declares no fields"));

        assertThat(registry.current().getVersion()).isEqualTo(before);
        assertThat(registry.current().size()).isEqualTo(4);
    }

    @Test
    void matchReportRanksCandidates() throws Exception {
        String body = "{\"text\": " + quote(TestFixtures.document("orange-polska.txt")) + ", \"locale\": \"pl\"}";

        mockMvc.perform(post("/api/templates/match-report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].templateId").value("orange-polska"))
                .andExpect(jsonPath("$[1].templateId").value("generic-pl"));
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
