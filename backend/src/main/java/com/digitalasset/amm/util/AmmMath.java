package com.digitalasset.amm.util;

import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.common.errors.InsufficientLiquidityError;
import com.digitalasset.amm.common.errors.InvalidReserveError;

import java.math.BigInteger;

import static com.digitalasset.amm.constants.SwapConstants.FEE_DENOMINATOR;
import static com.digitalasset.amm.constants.SwapConstants.FEE_NUMERATOR;

/**
 * Constant-product pricing shared by every exchange.
 *
 * Outputs round down and required inputs round up, so repeated trading can only grow
 * {@code inputReserve * outputReserve}.
 */
public final class AmmMath {

    private AmmMath() {
        // Utility class
    }

    /**
     * Amount received for selling exactly {@code inputAmount}.
     *
     * @param inputAmount   Amount sold into the pool
     * @param inputReserve  Pool reserve of the sold asset, before the trade
     * @param outputReserve Pool reserve of the bought asset, before the trade
     * @return {@code floor(in*997*outR / (inR*1000 + in*997))}
     */
    public static BigInteger priceForExactInput(
            final BigInteger inputAmount,
            final BigInteger inputReserve,
            final BigInteger outputReserve
    ) {
        requireReserves(inputReserve, outputReserve);
        BigInteger inputWithFee = Uint256.mul(inputAmount, FEE_NUMERATOR);
        BigInteger numerator = Uint256.mul(inputWithFee, outputReserve);
        BigInteger denominator = Uint256.add(Uint256.mul(inputReserve, FEE_DENOMINATOR), inputWithFee);
        return Uint256.div(numerator, denominator);
    }

    /**
     * Amount that must be sold to receive exactly {@code outputAmount}.
     *
     * @param outputAmount  Amount bought from the pool
     * @param inputReserve  Pool reserve of the sold asset, before the trade
     * @param outputReserve Pool reserve of the bought asset, before the trade
     * @return {@code floor(inR*out*1000 / ((outR-out)*997)) + 1}
     */
    public static BigInteger priceForExactOutput(
            final BigInteger outputAmount,
            final BigInteger inputReserve,
            final BigInteger outputReserve
    ) {
        requireReserves(inputReserve, outputReserve);
        if (Uint256.of(outputAmount).compareTo(outputReserve) >= 0) {
            throw new ExchangeException(new InsufficientLiquidityError(
                    "requested output " + outputAmount + " not below reserve " + outputReserve));
        }
        BigInteger numerator = Uint256.mul(Uint256.mul(inputReserve, outputAmount), FEE_DENOMINATOR);
        BigInteger denominator = Uint256.mul(Uint256.sub(outputReserve, outputAmount), FEE_NUMERATOR);
        return Uint256.add(Uint256.div(numerator, denominator), BigInteger.ONE);
    }

    /**
     * Constant-product invariant {@code k = reserveA * reserveB}.
     */
    public static BigInteger invariant(final BigInteger reserveA, final BigInteger reserveB) {
        return Uint256.of(reserveA).multiply(Uint256.of(reserveB));
    }

    private static void requireReserves(final BigInteger inputReserve, final BigInteger outputReserve) {
        if (!Uint256.isPositive(Uint256.of(inputReserve)) || !Uint256.isPositive(Uint256.of(outputReserve))) {
            throw new ExchangeException(new InvalidReserveError(
                    "reserves must be positive: in=" + inputReserve + ", out=" + outputReserve));
        }
    }
}
