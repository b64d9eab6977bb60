package com.flagship.gift_ledger.outbox;

import com.flagship.gift_ledger.account.AccountService;
import com.flagship.gift_ledger.catalog.CatalogService;
import com.flagship.gift_ledger.catalog.GiftCategory;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import com.flagship.gift_ledger.purchase.PurchaseItem;
import com.flagship.gift_ledger.purchase.PurchaseService;
import com.flagship.gift_ledger.transfer.GiftRedemptionService;
import com.flagship.gift_ledger.transfer.GiftTransferService;
import com.flagship.gift_ledger.transfer.IssuedGift;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox publisher against a real broker: events leave the outbox, keyed by
 * aggregate id, in the order they were recorded.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxKafkaIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("gift_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("spring.kafka.admin.auto-create", () -> "true");
        // Publisher bean enabled, but polled by the test rather than the scheduler
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private PurchaseService purchaseService;

    @Autowired
    private GiftTransferService transferService;

    @Autowired
    private GiftRedemptionService redemptionService;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Value("${kafka.topic.gifts}")
    private String giftsTopic;

    private UUID accountId;
    private GiftDefinition cinema;
    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        accountId = accountService.createAccount("kafka-" + suffix + "@example.com", "Kafka " + suffix, "hash");
        cinema = catalogService.createGiftDefinition("Film " + suffix, "🎬", null,
            GiftCategory.ENTERTAINMENT, new BigDecimal("12.50"));

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(giftsTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private List<ConsumerRecord<String, String>> consumeRecordsFor(String key, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> records = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (records.size() < expected && System.currentTimeMillis() < deadline) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(250))) {
                if (key.equals(record.key())) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    @Test
    @DisplayName("Gift events reach Kafka in order, keyed by gift transaction id")
    void testPublish_GiftLifecycleInOrder() {
        printTestHeader("Gift Lifecycle Published");
        purchaseService.purchase(accountId, List.of(new PurchaseItem(cinema.getId(), 1)));
        IssuedGift issued = transferService.send(accountId, cinema.getId(), "friend@example.com", null);
        redemptionService.redeem(issued.getRedemptionCode(), null);

        outboxPublisher.publishPendingEvents();

        assertEquals(0, outboxService.countUnpublished(), "All events should be published");

        String key = issued.getTransaction().getId().toString();
        List<ConsumerRecord<String, String>> records = consumeRecordsFor(key, 2, 15_000);
        assertEquals(2, records.size());
        assertTrue(records.get(0).value().contains("GiftSent"));
        assertTrue(records.get(1).value().contains("GiftRedeemed"));
        assertEquals(records.get(0).partition(), records.get(1).partition());
        assertFalse(records.get(0).value().contains(issued.getRedemptionCode()));

        List<OutboxEvent> events = outboxService.eventsFor("GiftTransaction", issued.getTransaction().getId());
        assertTrue(events.stream().allMatch(OutboxEvent::isPublished));
        printSuccess("Events published and marked");
    }
}
