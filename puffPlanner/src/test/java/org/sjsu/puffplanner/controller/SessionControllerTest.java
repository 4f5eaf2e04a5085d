package org.sjsu.puffplanner.controller;

import org.junit.jupiter.api.Test;
import org.sjsu.puffplanner.model.entity.WizardSession;
import org.sjsu.puffplanner.service.QuestionCatalog;
import org.sjsu.puffplanner.service.TestCatalogs;
import org.sjsu.puffplanner.service.store.SessionStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SessionController.class)
@Import(SessionControllerTest.CatalogConfig.class)
class SessionControllerTest {

    @TestConfiguration
    static class CatalogConfig {
        @Bean
        QuestionCatalog questionCatalog() {
            return TestCatalogs.reductionPlan();
        }
    }

    @Autowired
    MockMvc mvc;

    @MockBean
    SessionStore sessionStore;

    @Test
    void inProgressSession_showsAnswersByKeyAndNextPrompt() throws Exception {
        WizardSession session = new WizardSession(12L);
        session.recordAnswer("20");
        when(sessionStore.get(12L)).thenReturn(Optional.of(session));

        mvc.perform(get("/api/sessions/12"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(12))
                .andExpect(jsonPath("$.currentStep").value(1))
                .andExpect(jsonPath("$.totalSteps").value(3))
                .andExpect(jsonPath("$.nextPrompt").value(TestCatalogs.METHOD_PROMPT))
                .andExpect(jsonPath("$.answers.puffs").value("20"));
    }

    @Test
    void idleUser_isNotFound() throws Exception {
        when(sessionStore.get(13L)).thenReturn(Optional.empty());

        mvc.perform(get("/api/sessions/13"))
                .andExpect(status().isNotFound());
    }
}
