package com.heronix.callgate.controller.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.enums.AuthorizationStatus;
import com.heronix.callgate.model.enums.RegistrationStatus;
import com.heronix.callgate.support.CallGateTestSupport;

@AutoConfigureMockMvc
class RouterAdminControllerTest extends CallGateTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @WithMockUser(roles = "PROTOCOL_ADMIN")
    void operatorRevokesAnIntegration() throws Exception {
        Address identity = Address.random();

        mockMvc.perform(post("/api/v1/router/admin/authorization")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(identity, "revoked")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(1));

        assertThat(gateKeeper.getAuthorizationStatus(identity)).isEqualTo(AuthorizationStatus.REVOKED);
    }

    @Test
    @WithMockUser(roles = "PROTOCOL_ADMIN")
    void operatorRepairsRegistration() throws Exception {
        Address identity = Address.random();

        mockMvc.perform(post("/api/v1/router/admin/registration")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(identity, "REGISTERED")))
                .andExpect(status().isOk());

        assertThat(gateKeeper.getRegistrationStatus(identity)).isEqualTo(RegistrationStatus.REGISTERED);
    }

    @Test
    @WithMockUser(roles = "PROTOCOL_ADMIN")
    void mismatchedListsAreRejected() throws Exception {
        mockMvc.perform(post("/api/v1/router/admin/authorization")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identities\": [\"" + Address.random().value() + "\", \""
                                + Address.random().value() + "\"], \"statuses\": [\"BYPASSED\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ARRAY_LENGTH_MISMATCH"));
    }

    @Test
    @WithMockUser(roles = "PROTOCOL_ADMIN")
    void unknownStatusIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/router/admin/authorization")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Address.random(), "SUSPENDED")))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser(roles = "VIEWER")
    void otherRolesAreForbidden() throws Exception {
        Address identity = Address.random();

        mockMvc.perform(post("/api/v1/router/admin/authorization")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(identity, "BYPASSED")))
                .andExpect(status().isForbidden());

        assertThat(gateKeeper.getAuthorizationStatus(identity)).isEqualTo(AuthorizationStatus.INACTIVE);
    }

    @Test
    void anonymousCallersMustAuthenticate() throws Exception {
        mockMvc.perform(post("/api/v1/router/admin/authorization")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Address.random(), "BYPASSED")))
                .andExpect(status().isUnauthorized());
    }

    private static String body(Address identity, String status) {
        return "{\"identities\": [\"" + identity.value() + "\"], \"statuses\": [\"" + status + "\"]}";
    }
}
