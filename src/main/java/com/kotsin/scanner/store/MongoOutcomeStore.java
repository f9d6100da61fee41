package com.kotsin.scanner.store;

import com.kotsin.scanner.exception.InvariantViolationException;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.trading.risk.ClosedTradeOutcome;
import com.kotsin.scanner.trading.state.Trade;
import com.kotsin.scanner.trading.state.TradeState;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * MongoOutcomeStore - trades in the "trades" collection.
 *
 * Compare-and-set is a single findAndReplace filtered on id, state and version, so the document
 * is only replaced when nobody changed it since it was read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scanner.store", havingValue = "mongo")
public class MongoOutcomeStore implements OutcomeStore {

    private static final String COLLECTION = "trades";
    private static final int HISTORY_LIMIT = 100;

    private final MongoTemplate mongoTemplate;

    /**
     * Creates the unique signalId index behind one trade per signal, plus the history query index.
     */
    @PostConstruct
    public void ensureIndexes() {
        IndexOperations indexOps = mongoTemplate.indexOps(COLLECTION);
        indexOps.ensureIndex(new Index().on("signalId", Sort.Direction.ASC).unique().named("signalId_unique"));
        indexOps.ensureIndex(new Index()
                .on("symbol", Sort.Direction.ASC)
                .on("direction", Sort.Direction.ASC)
                .on("state", Sort.Direction.ASC)
                .on("closeTime", Sort.Direction.DESC)
                .named("symbol_direction_state_close_idx"));
        log.info("[OUTCOME_STORE] Indexes ensured on {}", COLLECTION);
    }

    @Override
    public List<ClosedTradeOutcome> queryClosedTrades(String symbol, Direction direction) {
        List<TradeState> terminal = Arrays.stream(TradeState.values()).filter(TradeState::isTerminal).toList();
        Query query = Query.query(Criteria.where("symbol").is(symbol)
                        .and("direction").is(direction)
                        .and("state").in(terminal))
                .with(Sort.by(Sort.Direction.DESC, "closeTime"))
                .limit(HISTORY_LIMIT);
        return mongoTemplate.find(query, Trade.class, COLLECTION).stream()
                .map(Trade::toOutcome)
                .toList();
    }

    @Override
    public String createTrade(Trade trade) {
        try {
            mongoTemplate.insert(trade, COLLECTION);
        } catch (DuplicateKeyException e) {
            throw new InvariantViolationException("Trade",
                    String.format("trade %s or signal %s already stored", trade.getId(), trade.getSignalId()));
        }
        log.debug("[OUTCOME_STORE] Created trade {} for {}", trade.getId(), trade.getSymbol());
        return trade.getId();
    }

    @Override
    public boolean compareAndSetTrade(String tradeId, TradeState expectedState, long expectedVersion, Trade updated) {
        Query query = Query.query(Criteria.where("_id").is(tradeId)
                .and("state").is(expectedState)
                .and("version").is(expectedVersion));
        Trade previous = mongoTemplate.findAndReplace(query, updated, COLLECTION);
        if (previous == null) {
            log.debug("[OUTCOME_STORE] CAS miss on {} (expected {} v{})", tradeId, expectedState, expectedVersion);
            return false;
        }
        return true;
    }

    @Override
    public Optional<Trade> findTrade(String tradeId) {
        return Optional.ofNullable(mongoTemplate.findById(tradeId, Trade.class, COLLECTION));
    }

    @Override
    public List<Trade> findOpenTrades(String symbol) {
        Query query = Query.query(Criteria.where("symbol").is(symbol).and("state").is(TradeState.OPEN))
                .with(Sort.by(Sort.Direction.ASC, "openTime"));
        return mongoTemplate.find(query, Trade.class, COLLECTION);
    }

    @Override
    public List<Trade> findAllOpenTrades() {
        Query query = Query.query(Criteria.where("state").is(TradeState.OPEN))
                .with(Sort.by(Sort.Direction.ASC, "openTime"));
        return mongoTemplate.find(query, Trade.class, COLLECTION);
    }

    @Override
    public List<Trade> findTradesOpenedBetween(Instant from, Instant to) {
        Query query = Query.query(Criteria.where("openTime").gte(from).lt(to))
                .with(Sort.by(Sort.Direction.ASC, "openTime"));
        return mongoTemplate.find(query, Trade.class, COLLECTION);
    }

    @Override
    public List<Trade> findTradesClosedBetween(Instant from, Instant to) {
        Query query = Query.query(Criteria.where("closeTime").gte(from).lt(to))
                .with(Sort.by(Sort.Direction.ASC, "closeTime"));
        return mongoTemplate.find(query, Trade.class, COLLECTION);
    }
}
