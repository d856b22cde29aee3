package org.blackjacksim.exception;

/**
 * A card was requested past the end of the shoe. The reshuffle check should make this
 * unreachable, so the run that hits it is dropped from the aggregation.
 */
public class ShoeExhaustedException extends SimulationException {
    public ShoeExhaustedException(int shoeSize) {
        super("Shoe exhausted after " + shoeSize + " cards without a reshuffle");
    }
}
