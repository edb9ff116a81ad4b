package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.entity.DashboardStatistics;
import com.gold.ledger.gold_ledger.entity.GoldRateStatistics;
import com.gold.ledger.gold_ledger.entity.Member;
import com.gold.ledger.gold_ledger.entity.Trade;
import com.gold.ledger.gold_ledger.entity.TradeStatistics;
import com.gold.ledger.gold_ledger.entity.TradeStatus;
import com.gold.ledger.gold_ledger.entity.TradeType;
import com.gold.ledger.gold_ledger.repositories.MemberRepository;
import com.gold.ledger.gold_ledger.repositories.TradeRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read-only figures for the admin dashboard and member overview.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerStatisticsService {

    private final TradeRepository tradeRepository;
    private final MemberRepository memberRepository;
    private final RateStore rateStore;

    /**
     * @param memberId restrict to one member, or null for all trades
     */
    public TradeStatistics tradeStatistics(String memberId) {
        long total;
        long completed;
        long pending;
        long buys;
        long sells;
        List<Trade> completedTrades;

        if (memberId == null) {
            total = tradeRepository.count();
            completed = tradeRepository.countByStatus(TradeStatus.COMPLETED);
            pending = tradeRepository.countByStatus(TradeStatus.PENDING);
            buys = tradeRepository.countByTradeType(TradeType.BUY);
            sells = tradeRepository.countByTradeType(TradeType.SELL);
            completedTrades = tradeRepository.findByStatus(TradeStatus.COMPLETED);
        } else {
            total = tradeRepository.countByMemberId(memberId);
            completed = tradeRepository.countByMemberIdAndStatus(memberId, TradeStatus.COMPLETED);
            pending = tradeRepository.countByMemberIdAndStatus(memberId, TradeStatus.PENDING);
            buys = tradeRepository.countByMemberIdAndTradeType(memberId, TradeType.BUY);
            sells = tradeRepository.countByMemberIdAndTradeType(memberId, TradeType.SELL);
            completedTrades = tradeRepository.findByMemberIdAndStatus(memberId, TradeStatus.COMPLETED);
        }

        TradeStatistics.Volume buyVolume = TradeStatistics.Volume.EMPTY;
        TradeStatistics.Volume sellVolume = TradeStatistics.Volume.EMPTY;
        for (Trade trade : completedTrades) {
            if (trade.getTradeType() == TradeType.BUY) {
                buyVolume = buyVolume.plus(trade);
            } else {
                sellVolume = sellVolume.plus(trade);
            }
        }

        return TradeStatistics.builder()
                .totalTrades(total)
                .completedTrades(completed)
                .pendingTrades(pending)
                .buyTrades(buys)
                .sellTrades(sells)
                .buyVolume(buyVolume)
                .sellVolume(sellVolume)
                .build();
    }

    public GoldRateStatistics goldRateStatistics() {
        return GoldRateStatistics.builder()
                .activeRate(rateStore.findActive().orElse(null))
                .totalHistoricalRates(rateStore.countAll())
                .build();
    }

    public DashboardStatistics dashboardStatistics() {
        List<Member> members = memberRepository.findAll();

        BigDecimal totalHoldings = BigDecimal.ZERO;
        for (Member member : members) {
            if (member.getGoldHoldings() != null) {
                totalHoldings = totalHoldings.add(member.getGoldHoldings());
            }
        }

        long pendingSells = tradeRepository.countByTradeTypeAndStatus(TradeType.SELL, TradeStatus.PENDING);
        log.debug("Dashboard: members={}, holdings={}, pendingSells={}", members.size(), totalHoldings, pendingSells);

        return DashboardStatistics.builder()
                .totalMembers(members.size())
                .totalGoldHoldings(totalHoldings)
                .pendingSellRequests(pendingSells)
                .build();
    }
}
