package com.royal.kotracker.application.service;

import com.royal.kotracker.application.config.TrackerSettings;
import com.royal.kotracker.domain.model.Hand;
import com.royal.kotracker.domain.model.HandKnockoutResult;
import com.royal.kotracker.domain.model.KnockoutCredit;
import com.royal.kotracker.domain.model.Pot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides how many knockouts Hero earned in a hand.
 * 
 * A bust is credited to Hero only when:
 * - the hand is at or above the minimum big blind,
 * - Hero won the most exclusive pot the busted player was eligible for,
 * - Hero's starting stack covered the busted player's starting stack.
 */
@Component
public class KnockoutAttributor {
    
    private static final Logger log = LoggerFactory.getLogger(KnockoutAttributor.class);
    
    /**
     * Credit Hero with the busts of one hand and count Hero's knockout attempts
     * @param hand Parsed hand with its pots settled
     * @param eliminated Players who busted in this hand, Hero excluded
     * @param settings Hero name, minimum big blind and diagnostics flag
     * @return Credits and attempts; empty when the hand is below the minimum big blind,
     *         Hero is not seated, or a seat name is duplicated
     */
    public HandKnockoutResult attribute(Hand hand, List<String> eliminated, TrackerSettings settings) {
        String hero = settings.getHero();
        HandKnockoutResult result = HandKnockoutResult.none(hand.getHandId(), eliminated);
        result.setTableSize(hand.getTableSize());
        result.setPlayersCount(hand.getSeats().size());
        result.setBb(hand.getBb());
        result.setHeroStack(hand.isSeated(hero) ? hand.stackOf(hero) : null);
        
        if (hand.getBb() < settings.getMinBigBlind() || !hand.isSeated(hero)) {
            return result;
        }
        if (!hand.getDuplicateSeatNames().isEmpty()) {
            log.warn("Hand {}: duplicate seat names {}, skipped for knockouts", 
                    hand.getHandId(), hand.getDuplicateSeatNames());
            return result;
        }
        
        result.setAttempts(countAttempts(hand, hero));
        
        long heroStack = hand.stackOf(hero);
        for (String bust : eliminated) {
            if (bust.equals(hero)) {
                continue;
            }
            if (!hand.isSeated(bust)) {
                log.debug("Hand {}: eliminated player {} has no seat, skipped", hand.getHandId(), bust);
                continue;
            }
            Optional<Pot> pot = contestedPot(hand, bust);
            if (pot.isEmpty()) {
                log.debug("Hand {}: eliminated player {} contested no pot", hand.getHandId(), bust);
                continue;
            }
            
            long bustStack = hand.stackOf(bust);
            boolean covered = heroStack >= bustStack;
            if (pot.get().isWonBy(hero) && covered) {
                KnockoutCredit credit = KnockoutCredit.builder()
                        .handId(hand.getHandId())
                        .eliminatedPlayer(bust)
                        .eliminatedStack(bustStack)
                        .heroStack(heroStack)
                        .potLevel(pot.get().getLevel())
                        .potSize(pot.get().getSize())
                        .potEligibleCount(pot.get().getEligible().size())
                        .build();
                result.addCredit(credit);
                if (settings.isDiagnostics()) {
                    log.info("KO -> {} via pot {} (hand {}, hero {} vs {})", 
                            bust, pot.get().getSize(), hand.getHandId(), heroStack, bustStack);
                }
            } else if (settings.isDiagnostics()) {
                log.info("No KO for {} in hand {}: heroWonPot={}, covered={}", 
                        bust, hand.getHandId(), pot.get().isWonBy(hero), covered);
            }
        }
        return result;
    }
    
    /**
     * The pot with the smallest eligible set among those the player was eligible for
     */
    Optional<Pot> contestedPot(Hand hand, String player) {
        return hand.getPots().stream()
                .filter(pot -> pot.isEligible(player))
                .min(Comparator.comparingInt(pot -> pot.getEligible().size()));
    }
    
    /**
     * Opponents who went all-in while Hero covered them and matched their contribution
     */
    int countAttempts(Hand hand, String hero) {
        long heroStack = hand.stackOf(hero);
        long heroContribution = hand.contributionOf(hero);
        int attempts = 0;
        for (String player : hand.getAllInPlayers()) {
            if (player.equals(hero)) {
                continue;
            }
            if (heroStack >= hand.stackOf(player) && heroContribution >= hand.contributionOf(player)) {
                attempts++;
            }
        }
        return attempts;
    }
}
