package io.echomail.backend.bounce;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.echomail.backend.testutil.MutableClock;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Security;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

@ExtendWith(MockitoExtension.class)
class BounceWebhookServiceTest {

  private static final String TIMESTAMP = "1772359200";

  private static KeyPair ecKeyPair;
  private static String publicKeyBase64;

  @Mock private SuppressionService suppressionService;

  private final ObjectMapper objectMapper = JsonMapper.builder().build();
  private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");

  @BeforeAll
  static void generateSigningKey() throws Exception {
    if (Security.getProvider("BC") == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
    KeyPairGenerator keyGen = KeyPairGenerator.getInstance("EC", "BC");
    keyGen.initialize(new ECGenParameterSpec("P-256"));
    ecKeyPair = keyGen.generateKeyPair();
    publicKeyBase64 = Base64.getEncoder().encodeToString(ecKeyPair.getPublic().getEncoded());
  }

  @BeforeEach
  void stubSuppression() {
    lenient()
        .when(suppressionService.recordAndEvaluate(any()))
        .thenAnswer(
            invocation -> {
              BounceRecord record = invocation.getArgument(0);
              return new EmailHealthStatus(
                  record.getAddress(),
                  record.getType() != BounceType.HARD,
                  1,
                  record.getType(),
                  record.getRecordedAt(),
                  record.getType() == BounceType.HARD,
                  null);
            });
  }

  private BounceWebhookService service(String verificationKey, String sharedToken) {
    return new BounceWebhookService(
        new BounceClassifier(),
        suppressionService,
        objectMapper,
        clock,
        verificationKey,
        sharedToken);
  }

  private static String sign(String payload) throws Exception {
    Signature signer = Signature.getInstance("SHA256withECDSA", "BC");
    signer.initSign(ecKeyPair.getPrivate());
    signer.update((TIMESTAMP + payload).getBytes(StandardCharsets.UTF_8));
    return Base64.getEncoder().encodeToString(signer.sign());
  }

  private List<BounceRecord> recordedBounces(int expected) {
    var captor = ArgumentCaptor.forClass(BounceRecord.class);
    verify(suppressionService, times(expected)).recordAndEvaluate(captor.capture());
    return captor.getAllValues();
  }

  @Test
  void sendgrid_events_are_verified_and_classified() throws Exception {
    String payload =
        """
        [
          {"email":"a@x.com","event":"bounce","type":"bounce",
           "reason":"550 5.1.1 User unknown",
           "sg_message_id":"msg-1.filter0001","campaignId":"c-1"},
          {"email":"b@x.com","event":"delivered"},
          {"email":"c@x.com","event":"spamreport"},
          {"email":"d@x.com","event":"bounce","type":"blocked","reason":"421 4.7.0 Try later"}
        ]
        """;

    var result = service(publicKeyBase64, "").processWebhook(
        "sendgrid", payload, sign(payload), TIMESTAMP, null);

    assertThat(result.provider()).isEqualTo("sendgrid");
    assertThat(result.processed()).isEqualTo(3);
    var records = recordedBounces(3);
    assertThat(records)
        .extracting(BounceRecord::getType)
        .containsExactly(BounceType.HARD, BounceType.COMPLAINT, BounceType.SOFT);
    assertThat(records.get(0).getMessageId()).isEqualTo("msg-1");
    assertThat(records.get(0).getCampaignId()).isEqualTo("c-1");
    assertThat(records.get(2).getCategory()).isEqualTo(BounceCategory.BLOCKED);
  }

  @Test
  void sendgrid_rejects_tampered_payload() throws Exception {
    String signed = "[{\"email\":\"a@x.com\",\"event\":\"bounce\"}]";
    String tampered = "[{\"email\":\"b@x.com\",\"event\":\"bounce\"}]";

    assertThatThrownBy(
            () ->
                service(publicKeyBase64, "")
                    .processWebhook("sendgrid", tampered, sign(signed), TIMESTAMP, null))
        .isInstanceOf(WebhookAuthenticationException.class);
    verify(suppressionService, never()).recordAndEvaluate(any());
  }

  @Test
  void sendgrid_is_rejected_without_verification_key() {
    assertThatThrownBy(
            () -> service("", "").processWebhook("sendgrid", "[]", "sig", TIMESTAMP, null))
        .isInstanceOf(WebhookAuthenticationException.class);
  }

  @Test
  void sendgrid_is_rejected_without_signature_headers() {
    assertThatThrownBy(
            () -> service(publicKeyBase64, "").processWebhook("sendgrid", "[]", null, null, null))
        .isInstanceOf(WebhookAuthenticationException.class);
  }

  @Test
  void ses_bounce_wrapped_in_sns_envelope() {
    String inner =
        objectMapper.writeValueAsString(
            Map.of(
                "notificationType", "Bounce",
                "mail", Map.of("messageId", "ses-1"),
                "bounce",
                    Map.of(
                        "bounceType", "Permanent",
                        "bouncedRecipients",
                            List.of(
                                Map.of(
                                    "emailAddress", "Ada@X.com",
                                    "diagnosticCode", "smtp; 550 5.1.1 no such user")))));
    String envelope =
        objectMapper.writeValueAsString(Map.of("Type", "Notification", "Message", inner));

    var result = service("", "").processWebhook("ses", envelope, null, null, null);

    assertThat(result.processed()).isEqualTo(1);
    var record = recordedBounces(1).get(0);
    assertThat(record.getAddress()).isEqualTo("ada@x.com");
    assertThat(record.getType()).isEqualTo(BounceType.HARD);
    assertThat(record.getCategory()).isEqualTo(BounceCategory.INVALID_ADDRESS);
    assertThat(record.getMessageId()).isEqualTo("ses-1");
  }

  @Test
  void ses_complaint_records_every_recipient() {
    String payload =
        """
        {"complaint":{"complainedRecipients":[
          {"emailAddress":"a@x.com"},{"emailAddress":"b@x.com"}]}}
        """;

    service("", "").processWebhook("ses", payload, null, null, null);

    assertThat(recordedBounces(2))
        .extracting(BounceRecord::getType)
        .containsOnly(BounceType.COMPLAINT);
  }

  @Test
  void shared_token_is_enforced_when_configured() {
    String payload = "{\"email\":\"a@x.com\",\"status\":\"550 5.1.1\"}";
    var service = service("", "s3cret");

    assertThatThrownBy(() -> service.processWebhook("gmail", payload, null, null, "wrong"))
        .isInstanceOf(WebhookAuthenticationException.class);
    assertThatThrownBy(() -> service.processWebhook("gmail", payload, null, null, null))
        .isInstanceOf(WebhookAuthenticationException.class);

    var result = service.processWebhook("gmail", payload, null, null, "s3cret");
    assertThat(result.processed()).isEqualTo(1);
  }

  @Test
  void gmail_bounce_uses_explicit_type_and_campaign() {
    String payload =
        """
        {"email":"a@x.com","status":"452 4.2.2","diagnostic":"452 4.2.2 Mailbox full",
         "bounceType":"permanent","campaignId":"c-7","messageId":"gm-9"}
        """;

    service("", "").processWebhook("gmail", payload, null, null, null);

    var record = recordedBounces(1).get(0);
    assertThat(record.getType()).isEqualTo(BounceType.HARD);
    assertThat(record.getReason()).isEqualTo("452 4.2.2 Mailbox full");
    assertThat(record.getCampaignId()).isEqualTo("c-7");
  }

  @Test
  void gmail_payload_without_email_is_invalid() {
    assertThatThrownBy(
            () ->
                service("", "")
                    .processWebhook("gmail", "{\"status\":\"550\"}", null, null, null))
        .isInstanceOf(WebhookPayloadException.class);
  }

  @Test
  void malformed_json_is_invalid() {
    assertThatThrownBy(() -> service("", "").processWebhook("ses", "{oops", null, null, null))
        .isInstanceOf(WebhookPayloadException.class);
  }

  @Test
  void json_null_payload_is_invalid() {
    assertThatThrownBy(() -> service("", "").processWebhook("gmail", "null", null, null, null))
        .isInstanceOf(WebhookPayloadException.class);
    assertThatThrownBy(() -> service("", "").processWebhook("ses", "null", null, null, null))
        .isInstanceOf(WebhookPayloadException.class);
  }

  @Test
  void json_null_sendgrid_payload_is_invalid_after_signature_check() throws Exception {
    assertThatThrownBy(
            () ->
                service(publicKeyBase64, "")
                    .processWebhook("sendgrid", "null", sign("null"), TIMESTAMP, null))
        .isInstanceOf(WebhookPayloadException.class);
  }

  @Test
  void unknown_provider_is_invalid() {
    assertThatThrownBy(
            () -> service("", "").processWebhook("mailchimp<script>", "{}", null, null, null))
        .isInstanceOf(WebhookPayloadException.class);
  }
}
