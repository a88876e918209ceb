package kr.jemi.zevent.ticket.infrastructure.out.payment.paypal;

import com.paypal.core.PayPalHttpClient;
import com.paypal.http.HttpResponse;
import com.paypal.http.exceptions.HttpException;
import com.paypal.orders.AmountBreakdown;
import com.paypal.orders.AmountWithBreakdown;
import com.paypal.orders.ApplicationContext;
import com.paypal.orders.Capture;
import com.paypal.orders.Item;
import com.paypal.orders.LinkDescription;
import com.paypal.orders.Order;
import com.paypal.orders.OrderActionRequest;
import com.paypal.orders.OrderRequest;
import com.paypal.orders.OrdersCaptureRequest;
import com.paypal.orders.OrdersCreateRequest;
import com.paypal.orders.OrdersGetRequest;
import com.paypal.orders.PurchaseUnit;
import com.paypal.orders.PurchaseUnitRequest;
import com.paypal.payments.CapturesRefundRequest;
import com.paypal.payments.Refund;
import com.paypal.payments.RefundRequest;
import kr.jemi.zevent.ticket.application.port.out.CheckoutSession;
import kr.jemi.zevent.ticket.application.port.out.PaymentCheck;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderException;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderPort;
import kr.jemi.zevent.ticket.domain.Buyer;
import kr.jemi.zevent.ticket.domain.EventInfo;
import kr.jemi.zevent.ticket.domain.Money;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.Ticket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * PayPal 주문은 구매자 승인(APPROVED) 후 서버가 명시적으로 캡처해야 결제가 끝난다.
 */
@Component
@ConditionalOnProperty(prefix = "zevent.paypal", name = "enabled", havingValue = "true")
public class PayPalPaymentAdapter implements PaymentProviderPort {

    private static final Logger log = LoggerFactory.getLogger(PayPalPaymentAdapter.class);

    private static final Set<String> ABANDONED_STATUSES = Set.of("VOIDED", "EXPIRED", "CANCELLED");
    private static final int UNPROCESSABLE_ENTITY = 422;

    private final PayPalHttpClient client;
    private final PayPalProperties properties;

    public PayPalPaymentAdapter(PayPalHttpClient client, PayPalProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public PaymentProviderType providerName() {
        return PaymentProviderType.PAYPAL;
    }

    @Override
    public CheckoutSession createCheckout(Ticket ticket, EventInfo event, Buyer buyer, BigDecimal totalAmount) {
        String ticketId = String.valueOf(ticket.getId());

        List<Item> items = new ArrayList<>();
        items.add(item("Ticket: " + event.name(), ticket.getPrice()));
        BigDecimal itemsTotal = ticket.getPrice();
        if (ticket.isIncludesPickup()) {
            items.add(item("Pickup service", ticket.getPickupPrice()));
            itemsTotal = itemsTotal.add(ticket.getPickupPrice());
        }
        if (itemsTotal.compareTo(totalAmount) != 0) {
            throw new PaymentProviderException(providerName(),
                    "결제 항목 합계가 총액과 다릅니다: items=" + itemsTotal + ", total=" + totalAmount);
        }

        OrderRequest orderRequest = new OrderRequest();
        orderRequest.checkoutPaymentIntent("CAPTURE");
        orderRequest.applicationContext(new ApplicationContext()
                .brandName(properties.brandName())
                .userAction("PAY_NOW")
                .shippingPreference("NO_SHIPPING")
                .returnUrl(properties.successUrl() + "?ticket_id=" + ticketId)
                .cancelUrl(properties.cancelUrl() + "?ticket_id=" + ticketId));

        PurchaseUnitRequest purchaseUnit = new PurchaseUnitRequest()
                .referenceId(ticketId)
                .customId(ticketId)
                .description(event.name())
                .amountWithBreakdown(new AmountWithBreakdown()
                        .currencyCode(Money.CURRENCY)
                        .value(Money.of(totalAmount).toPlainString())
                        .amountBreakdown(new AmountBreakdown()
                                .itemTotal(orderMoney(itemsTotal))))
                .items(items);
        orderRequest.purchaseUnits(List.of(purchaseUnit));

        OrdersCreateRequest request = new OrdersCreateRequest();
        request.prefer("return=representation");
        request.requestBody(orderRequest);

        try {
            HttpResponse<Order> response = client.execute(request);
            Order order = response.result();
            String approveUrl = approveLink(order);
            log.info("PayPal 주문 생성: ticketId={}, orderId={}", ticketId, order.id());
            return new CheckoutSession(approveUrl, PaymentReference.checkout(providerName(), order.id()));
        } catch (IOException e) {
            throw new PaymentProviderException(providerName(), "PayPal 주문 생성 실패: " + e.getMessage(), e);
        }
    }

    private Item item(String name, BigDecimal amount) {
        return new Item()
                .name(name)
                .quantity("1")
                .category("DIGITAL_GOODS")
                .unitAmount(orderMoney(amount));
    }

    private com.paypal.orders.Money orderMoney(BigDecimal amount) {
        return new com.paypal.orders.Money()
                .currencyCode(Money.CURRENCY)
                .value(Money.of(amount).toPlainString());
    }

    private String approveLink(Order order) {
        if (order.links() != null) {
            for (LinkDescription link : order.links()) {
                if ("approve".equals(link.rel()) || "payer-action".equals(link.rel())) {
                    return link.href();
                }
            }
        }
        throw new PaymentProviderException(providerName(), "PayPal 승인 링크가 없습니다: orderId=" + order.id());
    }

    @Override
    public void processRefund(Ticket ticket, BigDecimal amount) {
        String captureId = ticket.getPaypalCaptureId();
        if (captureId == null || captureId.isBlank()) {
            throw new PaymentProviderException(providerName(),
                    "환불할 캡처 ID가 없습니다: ticketId=" + ticket.getId());
        }
        RefundRequest refundRequest = new RefundRequest();
        refundRequest.amount(new com.paypal.payments.Money()
                .currencyCode(Money.CURRENCY)
                .value(Money.of(amount).toPlainString()));
        refundRequest.invoiceId("refund-" + ticket.getId());

        CapturesRefundRequest request = new CapturesRefundRequest(captureId);
        request.requestBody(refundRequest);
        try {
            HttpResponse<Refund> response = client.execute(request);
            Refund refund = response.result();
            if ("FAILED".equals(refund.status()) || "CANCELLED".equals(refund.status())) {
                throw new PaymentProviderException(providerName(),
                        "PayPal 환불 거절: ticketId=" + ticket.getId() + ", status=" + refund.status());
            }
            log.info("PayPal 환불 요청 완료: ticketId={}, captureId={}, amount={}, status={}",
                    ticket.getId(), captureId, amount, refund.status());
        } catch (IOException e) {
            throw new PaymentProviderException(providerName(), "PayPal 환불 실패: " + e.getMessage(), e);
        }
    }

    @Override
    public PaymentCheck checkAndCaptureOrder(Ticket ticket) {
        String orderId = ticket.getPaypalOrderId();
        if (orderId == null || orderId.isBlank()) {
            return PaymentCheck.pending();
        }
        Order order = getOrder(orderId);
        String status = order.status();

        if ("APPROVED".equals(status)) {
            order = capture(orderId);
            status = order.status();
        }
        if ("COMPLETED".equals(status)) {
            Capture capture = firstCapture(order);
            if (capture != null && "COMPLETED".equals(capture.status())) {
                return PaymentCheck.captured(new PaymentReference(providerName(), orderId, capture.id()));
            }
            // eCheck 등 보류 캡처는 PAYMENT.CAPTURE.COMPLETED 웹훅으로 확정된다
            return PaymentCheck.pending();
        }
        if (status != null && ABANDONED_STATUSES.contains(status)) {
            return PaymentCheck.abandoned();
        }
        return PaymentCheck.pending();
    }

    private Order getOrder(String orderId) {
        try {
            return client.execute(new OrdersGetRequest(orderId)).result();
        } catch (IOException e) {
            throw new PaymentProviderException(providerName(), "PayPal 주문 조회 실패: " + e.getMessage(), e);
        }
    }

    private Order capture(String orderId) {
        OrdersCaptureRequest request = new OrdersCaptureRequest(orderId);
        request.prefer("return=representation");
        request.requestBody(new OrderActionRequest());
        try {
            Order captured = client.execute(request).result();
            log.info("PayPal 주문 캡처: orderId={}, status={}", orderId, captured.status());
            return captured;
        } catch (HttpException e) {
            if (e.statusCode() == UNPROCESSABLE_ENTITY) {
                // 웹훅 경로가 먼저 캡처함 (ORDER_ALREADY_CAPTURED)
                log.info("PayPal 주문이 이미 캡처됨, 재조회: orderId={}", orderId);
                return getOrder(orderId);
            }
            throw new PaymentProviderException(providerName(), "PayPal 캡처 실패: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PaymentProviderException(providerName(), "PayPal 캡처 실패: " + e.getMessage(), e);
        }
    }

    private Capture firstCapture(Order order) {
        if (order.purchaseUnits() == null || order.purchaseUnits().isEmpty()) {
            return null;
        }
        PurchaseUnit unit = order.purchaseUnits().get(0);
        if (unit.payments() == null || unit.payments().captures() == null
                || unit.payments().captures().isEmpty()) {
            return null;
        }
        return unit.payments().captures().get(0);
    }
}
