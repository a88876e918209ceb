package kr.jemi.zevent.ticket.infrastructure.in.web;

import kr.jemi.zevent.common.exception.GlobalExceptionHandler;
import kr.jemi.zevent.ticket.application.port.in.AdminCancelTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.CancelEventTicketsUseCase;
import kr.jemi.zevent.ticket.application.port.in.RefundTicketUseCase;
import kr.jemi.zevent.ticket.domain.CancellationMode;
import kr.jemi.zevent.ticket.domain.CancellationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AdminTicketApiControllerTest {

    private static final String ADMIN_ID = "admin-1";

    @Mock
    private AdminCancelTicketUseCase adminCancelTicketUseCase;

    @Mock
    private RefundTicketUseCase refundTicketUseCase;

    @Mock
    private CancelEventTicketsUseCase cancelEventTicketsUseCase;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AdminTicketApiController controller = new AdminTicketApiController(
                adminCancelTicketUseCase, refundTicketUseCase, cancelEventTicketsUseCase);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("mode=no_refund를 NO_REFUND로 넘긴다")
    void shouldParseMode() throws Exception {
        given(adminCancelTicketUseCase.adminCancel(100L, CancellationMode.NO_REFUND, ADMIN_ID))
                .willReturn(CancellationResult.cancelled(100L, null));

        mockMvc.perform(post("/admin/tickets/{id}/cancel", 100L)
                        .header("X-Admin-Id", ADMIN_ID)
                        .param("mode", "no_refund"))
                .andExpect(status().isOk());

        then(adminCancelTicketUseCase).should().adminCancel(100L, CancellationMode.NO_REFUND, ADMIN_ID);
    }

    @Test
    @DisplayName("알 수 없는 mode는 INVALID_REQUEST(400)이고 취소를 시도하지 않는다")
    void shouldRejectUnknownMode() throws Exception {
        mockMvc.perform(post("/admin/tickets/{id}/cancel", 100L)
                        .header("X-Admin-Id", ADMIN_ID)
                        .param("mode", "everything"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        then(adminCancelTicketUseCase).shouldHaveNoInteractions();
    }
}
