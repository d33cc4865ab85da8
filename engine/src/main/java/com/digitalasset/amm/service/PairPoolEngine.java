// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.ArithmeticOverflowError;
import com.digitalasset.amm.common.errors.InsufficientBalanceError;
import com.digitalasset.amm.common.errors.InsufficientLiquidityError;
import com.digitalasset.amm.common.errors.InsufficientLiquidityMintedError;
import com.digitalasset.amm.common.errors.InvalidAmountError;
import com.digitalasset.amm.common.errors.PoolLockedError;
import com.digitalasset.amm.common.errors.TransferFailedError;
import com.digitalasset.amm.constants.PoolConstants;
import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;
import com.digitalasset.amm.domain.ClaimPosition;
import com.digitalasset.amm.domain.Pool;
import com.digitalasset.amm.domain.PoolSnapshot;
import com.digitalasset.amm.dto.AddLiquidityCommand;
import com.digitalasset.amm.dto.AddLiquidityResult;
import com.digitalasset.amm.dto.RemoveLiquidityCommand;
import com.digitalasset.amm.dto.RemoveLiquidityResult;
import com.digitalasset.amm.dto.SwapCommand;
import com.digitalasset.amm.dto.SwapResult;
import com.digitalasset.amm.events.LiquidityAddedEvent;
import com.digitalasset.amm.events.LiquidityRemovedEvent;
import com.digitalasset.amm.events.PoolEvent;
import com.digitalasset.amm.events.SwapExecutedEvent;
import com.digitalasset.amm.ledger.AssetLedger;
import com.digitalasset.amm.ledger.LedgerUndoLog;
import com.digitalasset.amm.ledger.PoolLedgers;
import com.digitalasset.amm.metrics.PoolMetrics;
import com.digitalasset.amm.util.AmmMath;
import com.digitalasset.amm.util.AmountOverflowException;
import com.digitalasset.amm.validation.PoolRequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Constant-product engine for a single token-pair pool.
 *
 * Every mutating operation runs under one pool lock, checks all preconditions before touching a
 * ledger, moves assets, then writes reserves and publishes one event. A failed transfer undoes
 * the ledger writes the operation already made, and nothing else. Events go out after the
 * operation has committed; a listener that throws is logged and does not fail the operation.
 * A call that re-enters the pool
 * from inside an operation (for example from a ledger callback) is rejected with LOCKED.
 */
public class PairPoolEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PairPoolEngine.class);

    static final String OP_ADD = "add_liquidity";
    static final String OP_REMOVE = "remove_liquidity";
    static final String OP_SWAP = "swap";
    static final String OP_SYNC = "sync";

    private final Pool pool;
    private final PoolLedgers ledgers;
    private final int feeBps;
    private final PoolRequestValidator validator;
    private final ApplicationEventPublisher eventPublisher;
    private final PoolMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock(true);

    public PairPoolEngine(
            final Pool pool,
            final PoolLedgers ledgers,
            final int feeBps,
            final PoolRequestValidator validator,
            final ApplicationEventPublisher eventPublisher,
            final PoolMetrics metrics
    ) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.ledgers = Objects.requireNonNull(ledgers, "ledgers");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (feeBps < 0 || feeBps > PoolConstants.MAX_FEE_BPS) {
            throw new IllegalArgumentException("feeBps must be within [0, " + PoolConstants.MAX_FEE_BPS + "], got " + feeBps);
        }
        this.feeBps = feeBps;
        ledgers.verifyMatches(pool);
    }

    public AssetId assetA() {
        return pool.assetA();
    }

    public AssetId assetB() {
        return pool.assetB();
    }

    public Address poolAddress() {
        return pool.address();
    }

    public int feeBps() {
        return feeBps;
    }

    // ========================================
    // DEPOSIT
    // ========================================

    @WithSpan
    public Result<AddLiquidityResult, DomainError> addLiquidity(final AddLiquidityCommand command) {
        Objects.requireNonNull(command, "command");
        return guarded(OP_ADD, () -> doAddLiquidity(command));
    }

    private Result<AddLiquidityResult, DomainError> doAddLiquidity(final AddLiquidityCommand command) {
        Optional<DomainError> expired = validator.deadlineNotExpired(command.deadline());
        if (expired.isPresent()) {
            return Result.err(expired.get());
        }
        Result<Pool.Side, DomainError> sideResult = validator.pair(pool, command.tokenA(), command.tokenB());
        if (sideResult.isErr()) {
            return Result.err(sideResult.getErrorUnsafe());
        }
        Optional<DomainError> invalid = firstPresent(
                () -> validator.positive("amountADesired", command.amountADesired()),
                () -> validator.positive("amountBDesired", command.amountBDesired()),
                () -> validator.nonNegative("amountAMin", command.amountAMin()),
                () -> validator.nonNegative("amountBMin", command.amountBMin()),
                () -> validator.minNotAboveDesired("amountA", command.amountAMin(), command.amountADesired()),
                () -> validator.minNotAboveDesired("amountB", command.amountBMin(), command.amountBDesired()));
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }

        // Caller order -> pool order
        boolean reversed = sideResult.getValueUnsafe() == Pool.Side.B;
        BigInteger desiredA = reversed ? command.amountBDesired() : command.amountADesired();
        BigInteger desiredB = reversed ? command.amountADesired() : command.amountBDesired();
        BigInteger minA = reversed ? command.amountBMin() : command.amountAMin();
        BigInteger minB = reversed ? command.amountAMin() : command.amountBMin();

        BigInteger reserveA = pool.reserveA();
        BigInteger reserveB = pool.reserveB();
        BigInteger totalSupply = ledgers.claimLedger().totalSupply();

        Result<BigInteger[], DomainError> accepted = acceptedAmounts(desiredA, desiredB, minA, minB, reserveA, reserveB, totalSupply);
        if (accepted.isErr()) {
            return Result.err(accepted.getErrorUnsafe());
        }
        BigInteger amountA = accepted.getValueUnsafe()[0];
        BigInteger amountB = accepted.getValueUnsafe()[1];

        BigInteger liquidity = AmmMath.liquidityMinted(amountA, amountB, reserveA, reserveB, totalSupply);
        if (liquidity.signum() == 0) {
            return Result.err(new InsufficientLiquidityMintedError(
                    "deposit " + amountA + "/" + amountB + " mints no claim tokens"));
        }
        // Post-deposit reserves must stay representable
        AmmMath.add(reserveA, amountA);
        AmmMath.add(reserveB, amountB);
        AmmMath.add(totalSupply, liquidity);

        Address sender = Objects.requireNonNull(command.sender(), "sender");
        Address to = Objects.requireNonNull(command.to(), "to");
        Optional<DomainError> funded = firstPresent(
                () -> checkFunded(ledgers.ledgerA(), sender, amountA),
                () -> checkFunded(ledgers.ledgerB(), sender, amountB));
        if (funded.isPresent()) {
            return Result.err(funded.get());
        }

        Address poolAddress = pool.address();
        Optional<DomainError> moved = moveAssets(List.of(
                pull(ledgers.ledgerA(), sender, amountA),
                pull(ledgers.ledgerB(), sender, amountB),
                step(ledgers.claimLedger().asset(), "mint " + liquidity + " claim tokens to " + to,
                        () -> {
                            ledgers.claimLedger().mint(to, liquidity);
                            return true;
                        },
                        () -> ledgers.claimLedger().burn(to, liquidity))));
        if (moved.isPresent()) {
            return Result.err(moved.get());
        }

        pool.updateReserves(ledgers.ledgerA().balanceOf(poolAddress), ledgers.ledgerB().balanceOf(poolAddress));
        publish(new LiquidityAddedEvent(sender, pool.assetA(), pool.assetB(), amountA, amountB, liquidity, validator.now()));

        LOG.info("[Pool {}] addLiquidity sender={} to={} amountA={} amountB={} liquidity={} reserves={}/{}",
                pool.pairName(), sender, to, amountA, amountB, liquidity, pool.reserveA(), pool.reserveB());
        return Result.ok(reversed
                ? new AddLiquidityResult(amountB, amountA, liquidity)
                : new AddLiquidityResult(amountA, amountB, liquidity));
    }

    /**
     * Amounts the pool accepts, in pool order. Bootstrap takes the desired amounts as given;
     * afterwards one side is reduced to match the reserve ratio.
     */
    private Result<BigInteger[], DomainError> acceptedAmounts(
            final BigInteger desiredA,
            final BigInteger desiredB,
            final BigInteger minA,
            final BigInteger minB,
            final BigInteger reserveA,
            final BigInteger reserveB,
            final BigInteger totalSupply
    ) {
        boolean bootstrap = (reserveA.signum() == 0 && reserveB.signum() == 0) || totalSupply.signum() == 0;
        if (bootstrap) {
            return Result.ok(new BigInteger[] {desiredA, desiredB});
        }
        if (reserveA.signum() == 0 || reserveB.signum() == 0) {
            return Result.err(new InsufficientLiquidityError(
                    "one-sided reserves " + reserveA + "/" + reserveB + " cannot price a deposit"));
        }

        BigInteger amountBOptimal = AmmMath.quote(desiredA, reserveA, reserveB);
        if (amountBOptimal.compareTo(desiredB) <= 0) {
            Optional<DomainError> slippage = validator.minOutputMet("amountBOptimal", amountBOptimal, minB);
            if (slippage.isPresent()) {
                return Result.err(slippage.get());
            }
            return Result.ok(new BigInteger[] {desiredA, amountBOptimal});
        }

        BigInteger amountAOptimal = AmmMath.quote(desiredB, reserveB, reserveA);
        Optional<DomainError> slippage = validator.minOutputMet("amountAOptimal", amountAOptimal, minA);
        if (slippage.isPresent()) {
            return Result.err(slippage.get());
        }
        return Result.ok(new BigInteger[] {amountAOptimal, desiredB});
    }

    // ========================================
    // WITHDRAWAL
    // ========================================

    @WithSpan
    public Result<RemoveLiquidityResult, DomainError> removeLiquidity(final RemoveLiquidityCommand command) {
        Objects.requireNonNull(command, "command");
        return guarded(OP_REMOVE, () -> doRemoveLiquidity(command));
    }

    private Result<RemoveLiquidityResult, DomainError> doRemoveLiquidity(final RemoveLiquidityCommand command) {
        Optional<DomainError> expired = validator.deadlineNotExpired(command.deadline());
        if (expired.isPresent()) {
            return Result.err(expired.get());
        }
        Result<Pool.Side, DomainError> sideResult = validator.pair(pool, command.tokenA(), command.tokenB());
        if (sideResult.isErr()) {
            return Result.err(sideResult.getErrorUnsafe());
        }
        Optional<DomainError> invalid = firstPresent(
                () -> validator.positive("liquidity", command.liquidity()),
                () -> validator.nonNegative("amountAMin", command.amountAMin()),
                () -> validator.nonNegative("amountBMin", command.amountBMin()));
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }

        Address sender = Objects.requireNonNull(command.sender(), "sender");
        Address to = Objects.requireNonNull(command.to(), "to");
        BigInteger liquidity = command.liquidity();
        BigInteger claimBalance = ledgers.claimLedger().balanceOf(sender);
        if (claimBalance.compareTo(liquidity) < 0) {
            return Result.err(new InsufficientBalanceError(
                    "claim balance of " + sender + " is " + claimBalance + ", need " + liquidity));
        }

        // Supply and balances read together, before any ledger call
        Address poolAddress = pool.address();
        BigInteger totalSupply = ledgers.claimLedger().totalSupply();
        BigInteger balanceA = ledgers.ledgerA().balanceOf(poolAddress);
        BigInteger balanceB = ledgers.ledgerB().balanceOf(poolAddress);

        BigInteger amountA = AmmMath.proportionalShare(liquidity, balanceA, totalSupply);
        BigInteger amountB = AmmMath.proportionalShare(liquidity, balanceB, totalSupply);
        if (amountA.signum() == 0 || amountB.signum() == 0) {
            return Result.err(new InsufficientLiquidityError(
                    "burning " + liquidity + " redeems " + amountA + "/" + amountB + ", nothing to withdraw"));
        }

        boolean reversed = sideResult.getValueUnsafe() == Pool.Side.B;
        BigInteger minA = reversed ? command.amountBMin() : command.amountAMin();
        BigInteger minB = reversed ? command.amountAMin() : command.amountBMin();
        Optional<DomainError> slippage = firstPresent(
                () -> validator.minOutputMet("amount " + pool.assetA(), amountA, minA),
                () -> validator.minOutputMet("amount " + pool.assetB(), amountB, minB));
        if (slippage.isPresent()) {
            return Result.err(slippage.get());
        }

        Optional<DomainError> moved = moveAssets(List.of(
                step(ledgers.claimLedger().asset(), "burn " + liquidity + " claim tokens from " + sender,
                        () -> {
                            ledgers.claimLedger().burn(sender, liquidity);
                            return true;
                        },
                        () -> ledgers.claimLedger().mint(sender, liquidity)),
                send(ledgers.ledgerA(), to, amountA),
                send(ledgers.ledgerB(), to, amountB)));
        if (moved.isPresent()) {
            return Result.err(moved.get());
        }

        pool.updateReserves(ledgers.ledgerA().balanceOf(poolAddress), ledgers.ledgerB().balanceOf(poolAddress));
        publish(new LiquidityRemovedEvent(sender, pool.assetA(), pool.assetB(), amountA, amountB, liquidity, validator.now()));

        LOG.info("[Pool {}] removeLiquidity sender={} to={} liquidity={} amountA={} amountB={} reserves={}/{}",
                pool.pairName(), sender, to, liquidity, amountA, amountB, pool.reserveA(), pool.reserveB());
        return Result.ok(reversed
                ? new RemoveLiquidityResult(amountB, amountA, liquidity)
                : new RemoveLiquidityResult(amountA, amountB, liquidity));
    }

    // ========================================
    // SWAP
    // ========================================

    @WithSpan
    public Result<SwapResult, DomainError> swapExactTokensForTokens(final SwapCommand command) {
        Objects.requireNonNull(command, "command");
        return guarded(OP_SWAP, () -> doSwap(command));
    }

    private Result<SwapResult, DomainError> doSwap(final SwapCommand command) {
        Optional<DomainError> expired = validator.deadlineNotExpired(command.deadline());
        if (expired.isPresent()) {
            return Result.err(expired.get());
        }
        Result<Pool.Side, DomainError> sideResult = validator.path(pool, command.path());
        if (sideResult.isErr()) {
            return Result.err(sideResult.getErrorUnsafe());
        }
        Optional<DomainError> invalid = firstPresent(
                () -> validator.positive("amountIn", command.amountIn()),
                () -> validator.nonNegative("amountOutMin", command.amountOutMin()));
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }

        Pool.Side inSide = sideResult.getValueUnsafe();
        Pool.Side outSide = inSide.other();
        BigInteger amountIn = command.amountIn();
        Result<BigInteger, DomainError> quoted = amountOutAt(amountIn, inSide);
        if (quoted.isErr()) {
            return Result.err(quoted.getErrorUnsafe());
        }
        BigInteger amountOut = quoted.getValueUnsafe();
        if (amountOut.signum() == 0) {
            return Result.err(new InvalidAmountError("amountIn " + amountIn + " is too small to yield any output"));
        }
        Optional<DomainError> slippage = validator.minOutputMet("amountOut", amountOut, command.amountOutMin());
        if (slippage.isPresent()) {
            return Result.err(slippage.get());
        }

        BigInteger newReserveIn = AmmMath.add(pool.reserve(inSide), amountIn);
        BigInteger newReserveOut = AmmMath.sub(pool.reserve(outSide), amountOut);

        Address sender = Objects.requireNonNull(command.sender(), "sender");
        Address to = Objects.requireNonNull(command.to(), "to");
        AssetLedger ledgerIn = ledgers.ledger(inSide);
        AssetLedger ledgerOut = ledgers.ledger(outSide);
        Optional<DomainError> funded = checkFunded(ledgerIn, sender, amountIn);
        if (funded.isPresent()) {
            return Result.err(funded.get());
        }

        AssetId tokenIn = pool.asset(inSide);
        AssetId tokenOut = pool.asset(outSide);
        Optional<DomainError> moved = moveAssets(List.of(
                pull(ledgerIn, sender, amountIn),
                send(ledgerOut, to, amountOut)));
        if (moved.isPresent()) {
            return Result.err(moved.get());
        }

        if (inSide == Pool.Side.A) {
            pool.updateReserves(newReserveIn, newReserveOut);
        } else {
            pool.updateReserves(newReserveOut, newReserveIn);
        }
        metrics.recordSwap(amountIn, amountOut);
        publish(new SwapExecutedEvent(sender, tokenIn, tokenOut, amountIn, amountOut, validator.now()));

        LOG.info("[Pool {}] swap sender={} to={} {} {} -> {} {} reserves={}/{}",
                pool.pairName(), sender, to, amountIn, tokenIn, amountOut, tokenOut, pool.reserveA(), pool.reserveB());
        return Result.ok(new SwapResult(tokenIn, tokenOut, amountIn, amountOut));
    }

    // ========================================
    // READS
    // ========================================

    /**
     * Output a swap of {@code amountIn} along {@code path} would yield at current reserves.
     * May be zero for dust inputs, which a swap would reject.
     */
    public Result<BigInteger, DomainError> getAmountOut(final BigInteger amountIn, final List<AssetId> path) {
        return read(() -> validator.path(pool, path).<BigInteger>flatMap(inSide -> {
            Optional<DomainError> invalid = validator.positive("amountIn", amountIn);
            if (invalid.isPresent()) {
                return Result.err(invalid.get());
            }
            return amountOutAt(amountIn, inSide);
        }));
    }

    /**
     * Smallest input along {@code path} that yields at least {@code amountOut}.
     */
    public Result<BigInteger, DomainError> getAmountIn(final BigInteger amountOut, final List<AssetId> path) {
        return read(() -> {
            Result<Pool.Side, DomainError> sideResult = validator.path(pool, path);
            if (sideResult.isErr()) {
                return Result.err(sideResult.getErrorUnsafe());
            }
            Optional<DomainError> invalid = validator.positive("amountOut", amountOut);
            if (invalid.isPresent()) {
                return Result.err(invalid.get());
            }
            Pool.Side inSide = sideResult.getValueUnsafe();
            BigInteger reserveIn = pool.reserve(inSide);
            BigInteger reserveOut = pool.reserve(inSide.other());
            if (reserveIn.signum() == 0 || reserveOut.compareTo(amountOut) <= 0) {
                return Result.err(new InsufficientLiquidityError(
                        "cannot buy " + amountOut + " from reserves " + reserveIn + "/" + reserveOut));
            }
            return Result.ok(AmmMath.getAmountIn(amountOut, reserveIn, reserveOut, feeBps));
        });
    }

    /**
     * Price of one unit of {@code base} in units of {@code quote}, scaled by 10^18.
     */
    public Result<BigInteger, DomainError> getPrice(final AssetId base, final AssetId quote) {
        return read(() -> validator.pair(pool, base, quote).<BigInteger>flatMap(baseSide -> {
            BigInteger reserveBase = pool.reserve(baseSide);
            if (reserveBase.signum() == 0) {
                return Result.err(new InsufficientLiquidityError("reserve of " + base + " is zero"));
            }
            return Result.ok(AmmMath.price(reserveBase, pool.reserve(baseSide.other())));
        }));
    }

    /**
     * Amount of {@code to} that matches {@code amount} of {@code from} at the current reserve ratio.
     */
    public Result<BigInteger, DomainError> quote(final BigInteger amount, final AssetId from, final AssetId to) {
        return read(() -> {
            Result<Pool.Side, DomainError> sideResult = validator.pair(pool, from, to);
            if (sideResult.isErr()) {
                return Result.err(sideResult.getErrorUnsafe());
            }
            Optional<DomainError> invalid = validator.positive("amount", amount);
            if (invalid.isPresent()) {
                return Result.err(invalid.get());
            }
            Pool.Side fromSide = sideResult.getValueUnsafe();
            BigInteger reserveFrom = pool.reserve(fromSide);
            BigInteger reserveTo = pool.reserve(fromSide.other());
            if (reserveFrom.signum() == 0 || reserveTo.signum() == 0) {
                return Result.err(new InsufficientLiquidityError("pool " + pool.pairName() + " has no liquidity"));
            }
            return Result.ok(AmmMath.quote(amount, reserveFrom, reserveTo));
        });
    }

    public PoolSnapshot getReserves() {
        lock.lock();
        try {
            return pool.snapshot(ledgers.claimLedger().totalSupply());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claim balance of {@code owner} and what burning all of it would redeem right now.
     */
    public ClaimPosition position(final Address owner) {
        Objects.requireNonNull(owner, "owner");
        lock.lock();
        try {
            BigInteger liquidity = ledgers.claimLedger().balanceOf(owner);
            BigInteger totalSupply = ledgers.claimLedger().totalSupply();
            if (totalSupply.signum() == 0 || liquidity.signum() == 0) {
                return new ClaimPosition(owner, liquidity, totalSupply, 0L, BigInteger.ZERO, BigInteger.ZERO);
            }
            long shareBps = liquidity.multiply(PoolConstants.BPS_DENOMINATOR).divide(totalSupply).longValueExact();
            BigInteger redeemableA = AmmMath.proportionalShare(liquidity, ledgers.ledgerA().balanceOf(pool.address()), totalSupply);
            BigInteger redeemableB = AmmMath.proportionalShare(liquidity, ledgers.ledgerB().balanceOf(pool.address()), totalSupply);
            return new ClaimPosition(owner, liquidity, totalSupply, shareBps, redeemableA, redeemableB);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force the reserves to the pool's ledger balances, absorbing direct transfers to the pool.
     */
    @WithSpan
    public Result<PoolSnapshot, DomainError> sync() {
        return guarded(OP_SYNC, () -> {
            Address poolAddress = pool.address();
            BigInteger balanceA = ledgers.ledgerA().balanceOf(poolAddress);
            BigInteger balanceB = ledgers.ledgerB().balanceOf(poolAddress);
            if (!AmmMath.fitsUint256(balanceA) || !AmmMath.fitsUint256(balanceB)) {
                return Result.err(new ArithmeticOverflowError("pool balances exceed the 256-bit range"));
            }
            if (!balanceA.equals(pool.reserveA()) || !balanceB.equals(pool.reserveB())) {
                LOG.info("[Pool {}] sync reserves {}/{} -> {}/{}",
                        pool.pairName(), pool.reserveA(), pool.reserveB(), balanceA, balanceB);
            }
            pool.updateReserves(balanceA, balanceB);
            return Result.ok(pool.snapshot(ledgers.claimLedger().totalSupply()));
        });
    }

    // ========================================
    // INTERNALS
    // ========================================

    private Result<BigInteger, DomainError> amountOutAt(final BigInteger amountIn, final Pool.Side inSide) {
        BigInteger reserveIn = pool.reserve(inSide);
        BigInteger reserveOut = pool.reserve(inSide.other());
        if (reserveIn.signum() == 0 || reserveOut.signum() == 0) {
            return Result.err(new InsufficientLiquidityError("pool " + pool.pairName() + " has no liquidity"));
        }
        return Result.ok(AmmMath.getAmountOut(amountIn, reserveIn, reserveOut, feeBps));
    }

    private Optional<DomainError> checkFunded(final AssetLedger ledger, final Address owner, final BigInteger amount) {
        BigInteger balance = ledger.balanceOf(owner);
        if (balance.compareTo(amount) < 0) {
            return Optional.of(new InsufficientBalanceError(
                    "Insufficient " + ledger.asset() + ": have " + balance + ", need " + amount));
        }
        BigInteger allowance = ledger.allowance(owner, pool.address());
        if (allowance.compareTo(amount) < 0) {
            return Optional.of(new InsufficientBalanceError(
                    "Insufficient " + ledger.asset() + " allowance for pool: have " + allowance + ", need " + amount));
        }
        return Optional.empty();
    }

    /**
     * Run ledger steps in order. The first step that reports failure or throws undoes the steps
     * completed before it, newest first.
     */
    private Optional<DomainError> moveAssets(final List<LedgerStep> steps) {
        LedgerUndoLog undoLog = new LedgerUndoLog("Pool " + pool.pairName());
        for (LedgerStep step : steps) {
            boolean done;
            try {
                done = step.action().getAsBoolean();
            } catch (RuntimeException e) {
                LOG.error("[Pool {}] ledger call threw during '{}'", pool.pairName(), step.description(), e);
                done = false;
            }
            if (!done) {
                int undone = undoLog.size();
                if (undoLog.rollback()) {
                    LOG.warn("[Pool {}] '{}' failed, {} earlier step(s) undone", pool.pairName(), step.description(), undone);
                }
                return Optional.of(new TransferFailedError(step.asset().value(), step.description() + " failed"));
            }
            undoLog.record(step.description(), step.undo());
        }
        return Optional.empty();
    }

    private <T> Result<T, DomainError> guarded(final String operation, final Supplier<Result<T, DomainError>> body) {
        if (lock.isHeldByCurrentThread()) {
            return rejected(operation, new PoolLockedError(operation + " re-entered pool " + pool.pairName()));
        }
        lock.lock();
        long start = System.nanoTime();
        try {
            Result<T, DomainError> result;
            try {
                result = body.get();
            } catch (AmountOverflowException e) {
                result = Result.err(new ArithmeticOverflowError(e.getMessage()));
            }
            if (result.isErr()) {
                return rejected(operation, result.getErrorUnsafe());
            }
            metrics.recordExecuted(operation, System.nanoTime() - start);
            metrics.recordPoolLiquidity(pool.snapshot(ledgers.claimLedger().totalSupply()));
            return result;
        } finally {
            lock.unlock();
        }
    }

    private <T> Result<T, DomainError> read(final Supplier<Result<T, DomainError>> body) {
        lock.lock();
        try {
            return body.get();
        } catch (AmountOverflowException e) {
            return Result.err(new ArithmeticOverflowError(e.getMessage()));
        } finally {
            lock.unlock();
        }
    }

    private <T> Result<T, DomainError> rejected(final String operation, final DomainError error) {
        LOG.warn("[Pool {}] {} rejected: {} - {}", pool.pairName(), operation, error.code(), error.message());
        metrics.recordRejected(operation, error.code());
        return Result.err(error);
    }

    private void publish(final PoolEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.error("[Pool {}] listener failed on committed {}", pool.pairName(), event.getClass().getSimpleName(), e);
            metrics.recordEventDeliveryFailed(event.getClass().getSimpleName());
        }
    }

    @SafeVarargs
    private static Optional<DomainError> firstPresent(final Supplier<Optional<DomainError>>... checks) {
        for (Supplier<Optional<DomainError>> check : checks) {
            Optional<DomainError> error = check.get();
            if (error.isPresent()) {
                return error;
            }
        }
        return Optional.empty();
    }

    private static LedgerStep step(
            final AssetId asset,
            final String description,
            final BooleanSupplier action,
            final Runnable undo
    ) {
        return new LedgerStep(asset, description, action, undo);
    }

    /**
     * Pull {@code amount} from {@code sender} into the pool against its allowance. The undo pays
     * the amount back and restores the allowance it consumed.
     */
    private LedgerStep pull(final AssetLedger ledger, final Address sender, final BigInteger amount) {
        Address poolAddress = pool.address();
        return step(ledger.asset(), "pull " + amount + " " + ledger.asset() + " from " + sender,
                () -> ledger.transferFrom(poolAddress, sender, poolAddress, amount),
                () -> {
                    requireDone(ledger.transfer(poolAddress, sender, amount),
                            "return " + amount + " " + ledger.asset() + " to " + sender);
                    ledger.increaseAllowance(sender, poolAddress, amount);
                });
    }

    private LedgerStep send(final AssetLedger ledger, final Address to, final BigInteger amount) {
        Address poolAddress = pool.address();
        return step(ledger.asset(), "send " + amount + " " + ledger.asset() + " to " + to,
                () -> ledger.transfer(poolAddress, to, amount),
                () -> requireDone(ledger.reverseTransfer(poolAddress, to, amount),
                        "reclaim " + amount + " " + ledger.asset() + " from " + to));
    }

    private static void requireDone(final boolean done, final String description) {
        if (!done) {
            throw new IllegalStateException(description + " was refused by the ledger");
        }
    }

    private record LedgerStep(AssetId asset, String description, BooleanSupplier action, Runnable undo) {}
}
