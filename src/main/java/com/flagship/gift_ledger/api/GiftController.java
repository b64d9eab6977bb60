package com.flagship.gift_ledger.api;

import com.flagship.gift_ledger.api.dto.GiftPreviewResponse;
import com.flagship.gift_ledger.api.dto.GiftSummary;
import com.flagship.gift_ledger.api.dto.GiftTypeResponse;
import com.flagship.gift_ledger.api.dto.GiftTypesResponse;
import com.flagship.gift_ledger.api.dto.InventoryItemResponse;
import com.flagship.gift_ledger.api.dto.InventoryResponse;
import com.flagship.gift_ledger.api.dto.PurchaseItemRequest;
import com.flagship.gift_ledger.api.dto.PurchaseRequest;
import com.flagship.gift_ledger.api.dto.PurchaseResponse;
import com.flagship.gift_ledger.api.dto.SendGiftRequest;
import com.flagship.gift_ledger.api.dto.SendGiftResponse;
import com.flagship.gift_ledger.api.dto.SentGiftResponse;
import com.flagship.gift_ledger.api.dto.SentGiftsResponse;
import com.flagship.gift_ledger.api.dto.SyncRequest;
import com.flagship.gift_ledger.api.dto.SyncResponse;
import com.flagship.gift_ledger.catalog.CatalogService;
import com.flagship.gift_ledger.exception.ErrorResponse;
import com.flagship.gift_ledger.exception.GiftErrorCode;
import com.flagship.gift_ledger.inventory.InventoryLedgerService;
import com.flagship.gift_ledger.purchase.PurchaseItem;
import com.flagship.gift_ledger.purchase.PurchaseResult;
import com.flagship.gift_ledger.purchase.PurchaseService;
import com.flagship.gift_ledger.sync.DeviceSyncService;
import com.flagship.gift_ledger.transfer.GiftPreview;
import com.flagship.gift_ledger.transfer.GiftTransaction;
import com.flagship.gift_ledger.transfer.GiftTransactionPersistenceService;
import com.flagship.gift_ledger.transfer.GiftTransferService;
import com.flagship.gift_ledger.transfer.IssuedGift;
import com.flagship.gift_ledger.transfer.RedemptionCodeVerifier;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Account-facing gift endpoints.
 *
 * The gateway in front of this service authenticates the caller and passes
 * the account id in {@code X-Account-Id}.
 */
@RestController
@RequestMapping("/api/gifts")
@Slf4j
public class GiftController {

    static final String ACCOUNT_ID_HEADER = "X-Account-Id";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CatalogService catalogService;
    private final PurchaseService purchaseService;
    private final InventoryLedgerService inventoryLedger;
    private final GiftTransferService transferService;
    private final RedemptionCodeVerifier codeVerifier;
    private final DeviceSyncService syncService;
    private final String claimBaseUrl;

    public GiftController(CatalogService catalogService,
                          PurchaseService purchaseService,
                          InventoryLedgerService inventoryLedger,
                          GiftTransferService transferService,
                          RedemptionCodeVerifier codeVerifier,
                          DeviceSyncService syncService,
                          @Value("${gifting.claim-base-url:https://cadeautjes.app/claim}") String claimBaseUrl) {
        this.catalogService = catalogService;
        this.purchaseService = purchaseService;
        this.inventoryLedger = inventoryLedger;
        this.transferService = transferService;
        this.codeVerifier = codeVerifier;
        this.syncService = syncService;
        this.claimBaseUrl = claimBaseUrl.endsWith("/")
            ? claimBaseUrl.substring(0, claimBaseUrl.length() - 1)
            : claimBaseUrl;
    }

    @GetMapping("/types")
    public ResponseEntity<GiftTypesResponse> listGiftTypes() {
        List<GiftTypeResponse> types = catalogService.listGiftTypes()
            .stream()
            .map(GiftTypeResponse::from)
            .toList();
        return ResponseEntity.ok(new GiftTypesResponse(types));
    }

    /**
     * 201 for a new purchase, 200 when an {@code Idempotency-Key} replays an
     * earlier one.
     */
    @PostMapping("/purchase")
    public ResponseEntity<PurchaseResponse> purchase(
            @RequestHeader(ACCOUNT_ID_HEADER) UUID accountId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody PurchaseRequest request) {

        log.info("Received purchase request: lines={}, idempotencyKey={}", request.getItems().size(), idempotencyKey);

        List<PurchaseItem> items = request.getItems().stream()
            .map(GiftController::toPurchaseItem)
            .toList();
        PurchaseResult result;
        try {
            result = purchaseService.purchase(accountId, items, idempotencyKey);
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null || idempotencyKey.isBlank()) {
                throw e;
            }
            log.info("Concurrent purchase with idempotency key {} committed first, replaying it", idempotencyKey);
            result = purchaseService.purchase(accountId, items, idempotencyKey);
        }

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PurchaseResponse.from(result.getReceipt()));
    }

    @GetMapping("/inventory")
    public ResponseEntity<InventoryResponse> inventory(@RequestHeader(ACCOUNT_ID_HEADER) UUID accountId) {
        List<InventoryItemResponse> items = inventoryLedger.query(accountId)
            .stream()
            .map(InventoryItemResponse::from)
            .toList();
        return ResponseEntity.ok(new InventoryResponse(items));
    }

    @PostMapping("/send")
    public ResponseEntity<SendGiftResponse> send(
            @RequestHeader(ACCOUNT_ID_HEADER) UUID accountId,
            @Valid @RequestBody SendGiftRequest request) {

        IssuedGift issued = transferService.send(
            accountId, request.getGiftTypeId(), request.getReceiverEmail(), request.getMessage());
        GiftTransaction transaction = issued.getTransaction();

        SendGiftResponse response = SendGiftResponse.builder()
            .transactionId(transaction.getId())
            .gift(GiftSummary.of(issued.getGift()))
            .qrCode(GiftTransactionPersistenceService.QR_PAYLOAD_PREFIX + issued.getRedemptionCode())
            .claimUrl(claimBaseUrl + "/" + transaction.getId())
            .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/sent")
    public ResponseEntity<SentGiftsResponse> sent(@RequestHeader(ACCOUNT_ID_HEADER) UUID accountId) {
        List<SentGiftResponse> sent = transferService.sentHistory(accountId, 0)
            .stream()
            .map(SentGiftResponse::from)
            .toList();
        return ResponseEntity.ok(new SentGiftsResponse(sent));
    }

    /**
     * Public preview of a gift. 410 once it has been redeemed.
     */
    @GetMapping("/claim/{codeOrId}")
    public ResponseEntity<Object> claim(@PathVariable String codeOrId) {
        GiftPreview preview = codeVerifier.preview(codeOrId);

        if (preview.isRedeemed()) {
            ErrorResponse gone = ErrorResponse.builder()
                .error("Gift Already Claimed")
                .message("This gift has already been redeemed")
                .details(Map.of(
                    "code", GiftErrorCode.ALREADY_REDEEMED.name(),
                    "redeemedAt", String.valueOf(preview.getRedeemedAt())))
                .timestamp(Instant.now())
                .build();
            return ResponseEntity.status(HttpStatus.GONE).body(gone);
        }

        return ResponseEntity.ok(GiftPreviewResponse.from(preview));
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncResponse> sync(
            @RequestHeader(ACCOUNT_ID_HEADER) UUID accountId,
            @Valid @RequestBody(required = false) SyncRequest request) {
        String deviceId = request != null ? request.getDeviceId() : null;
        return ResponseEntity.ok(SyncResponse.from(syncService.sync(accountId, deviceId)));
    }

    private static PurchaseItem toPurchaseItem(PurchaseItemRequest item) {
        return new PurchaseItem(item.getGiftTypeId(), item.getQuantity());
    }
}
