package com.example.identity.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.identity.model.AccountProfile;
import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountRole;
import com.example.identity.model.AccountStatus;
import com.example.identity.service.AccountService;
import com.example.identity.service.AuthenticationService;
import com.example.identity.service.IdentityException;
import com.example.identity.service.ProfileUpdate;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MeController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(IdentityApiExceptionHandler.class)
class MeControllerTest {

  private static final TestingAuthenticationToken ALICE =
      new TestingAuthenticationToken("acc-1", "N/A", "ROLE_USER");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AccountService accountService;
  @MockitoBean private AuthenticationService authenticationService;

  private static AccountRecord alice() {
    final Instant now = Instant.parse("2026-01-01T00:00:00Z");
    return AccountRecord.builder()
        .id("acc-1")
        .email("a@x.com")
        .username("alice")
        .passwordHash("$2a$04$digest")
        .emailVerified(true)
        .profile(new AccountProfile("Alice", null, null, null, null, null))
        .role(AccountRole.USER)
        .status(AccountStatus.ACTIVE)
        .active(true)
        .createdAt(now)
        .updatedAt(now)
        .version(1L)
        .build();
  }

  @Test
  void getMeUsesAuthenticatedSubject() throws Exception {
    when(accountService.getAccount("acc-1")).thenReturn(alice());

    mockMvc
        .perform(get("/me").principal(ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accountId").value("acc-1"))
        .andExpect(jsonPath("$.hasPassword").value(true))
        .andExpect(jsonPath("$.firstName").value("Alice"))
        .andExpect(jsonPath("$.passwordHash").doesNotExist());
  }

  @Test
  void patchMeForwardsProfileUpdate() throws Exception {
    when(accountService.updateProfile(eq("acc-1"), any(ProfileUpdate.class))).thenReturn(alice());

    mockMvc
        .perform(
            patch("/me")
                .principal(ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"nickname\":\"al\",\"bio\":\"hello\"}"))
        .andExpect(status().isOk());

    verify(accountService)
        .updateProfile(
            "acc-1",
            new ProfileUpdate(null, null, new AccountProfile(null, null, "al", null, null, "hello")));
  }

  @Test
  void changePasswordWithoutPasswordReturns400() throws Exception {
    doThrow(IdentityException.noPasswordSet())
        .when(authenticationService)
        .changePassword("acc-1", "whatever1", "NewSecret1");

    mockMvc
        .perform(
            post("/me/password")
                .principal(ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"currentPassword\":\"whatever1\",\"newPassword\":\"NewSecret1\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NO_PASSWORD_SET"));
  }

  @Test
  void resendVerificationIsAccepted() throws Exception {
    mockMvc.perform(post("/me/email-verification").principal(ALICE)).andExpect(status().isAccepted());

    verify(authenticationService).resendEmailVerification("acc-1");
  }
}
