package com.wtbmonitor.market.service;

import com.wtbmonitor.market.demand.DemandAggregator;
import com.wtbmonitor.market.matching.IdentityResolver;
import com.wtbmonitor.market.matching.InventorySnapshot;
import com.wtbmonitor.market.model.ClassificationResult;
import com.wtbmonitor.market.model.ClassificationSummary;
import com.wtbmonitor.market.model.DemandRecord;
import com.wtbmonitor.market.model.InStockItem;
import com.wtbmonitor.market.model.InventoryObservation;
import com.wtbmonitor.market.model.MatchVerdict;
import com.wtbmonitor.market.model.MissingItem;
import com.wtbmonitor.market.model.NoDemandItem;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.ScrapeSession;
import com.wtbmonitor.market.model.WtbObservation;
import com.wtbmonitor.market.persistence.ObservationRepository;
import com.wtbmonitor.market.persistence.ScrapeSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Partitions one WTB session against one inventory session into missing, in-stock and no-demand lists.
 * Demand is resolved in descending demand order and each inventory item is claimed by at most one record.
 */
@Service
public class ClassificationService {
    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    private static final Comparator<NoDemandItem> BY_PRODUCT_NAME = Comparator
        .comparing((NoDemandItem item) -> nullToEmpty(item.myProductName()), String.CASE_INSENSITIVE_ORDER)
        .thenComparing(item -> nullToEmpty(item.myProductName()));

    private final ScrapeSessionRepository sessionRepository;
    private final ObservationRepository observationRepository;
    private final DemandAggregator demandAggregator;
    private final IdentityResolver identityResolver;
    private final Clock clock;

    public ClassificationService(
        ScrapeSessionRepository sessionRepository,
        ObservationRepository observationRepository,
        DemandAggregator demandAggregator,
        IdentityResolver identityResolver,
        Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.observationRepository = observationRepository;
        this.demandAggregator = demandAggregator;
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    public ClassificationResult classify() {
        return classify(null, null);
    }

    /**
     * Null ids resolve to the latest completed session of the kind. An id that is unknown, incomplete or
     * of the other kind counts as absent.
     */
    public ClassificationResult classify(String wtbSessionId, String inventorySessionId) {
        Optional<String> wtbSession = resolveSession(ScrapeKind.WTB, wtbSessionId);
        if (wtbSession.isEmpty()) {
            log.debug("No completed WTB session; returning empty classification");
            return ClassificationResult.empty(clock.instant());
        }
        Optional<String> inventorySession = resolveSession(ScrapeKind.INVENTORY, inventorySessionId);

        List<WtbObservation> wtbObservations = observationRepository.wtbObservationsForSession(wtbSession.get());
        List<InventoryObservation> inventory = inventorySession
            .map(observationRepository::inventoryObservationsForSession)
            .orElse(List.of());

        List<DemandRecord> demand = new ArrayList<>(demandAggregator.aggregate(wtbObservations));
        demand.sort(Comparator.comparingInt(DemandRecord::demandCount).reversed());

        InventorySnapshot snapshot = identityResolver.snapshot(inventory);
        List<MissingItem> missing = new ArrayList<>();
        List<InStockItem> inStock = new ArrayList<>();
        BitSet claimed = new BitSet(snapshot.size());
        for (DemandRecord record : demand) {
            MatchVerdict verdict = identityResolver.resolve(record, snapshot, claimed);
            if (verdict.isMatch()) {
                claimed.set(verdict.inventoryIndex());
                inStock.add(InStockItem.from(record, verdict));
            } else {
                missing.add(MissingItem.from(record));
            }
        }

        List<NoDemandItem> noDemand = new ArrayList<>();
        for (int i = 0; i < snapshot.size(); i++) {
            if (!claimed.get(i)) {
                noDemand.add(NoDemandItem.from(snapshot.item(i)));
            }
        }
        noDemand.sort(BY_PRODUCT_NAME);

        ClassificationSummary summary = new ClassificationSummary(
            wtbSession.get(),
            inventorySession.orElse(null),
            demand.size(),
            wtbObservations.size(),
            snapshot.size(),
            missing.size(),
            inStock.size(),
            noDemand.size(),
            claimed.cardinality()
        );
        log.info(
            "Classified WTB session {} against inventory session {}: missing={} inStock={} noDemand={}",
            summary.wtbSessionId(),
            summary.inventorySessionId(),
            summary.missingCount(),
            summary.inStockCount(),
            summary.noDemandCount()
        );
        return new ClassificationResult(missing, inStock, noDemand, summary, clock.instant());
    }

    private Optional<String> resolveSession(ScrapeKind kind, String explicitId) {
        if (explicitId == null || explicitId.isBlank()) {
            return sessionRepository.latestCompletedSession(kind);
        }
        Optional<ScrapeSession> session = sessionRepository.findSession(explicitId);
        if (session.isEmpty() || session.get().kind() != kind || !session.get().isCompleted()) {
            log.debug("Ignoring {} session id {}: unknown, incomplete or of another kind", kind, explicitId);
            return Optional.empty();
        }
        return Optional.of(session.get().sessionId());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
