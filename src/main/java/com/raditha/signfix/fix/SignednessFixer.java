package com.raditha.signfix.fix;

import com.raditha.signfix.locate.ExpressionLocator;
import com.raditha.signfix.locate.LocateException;
import com.raditha.signfix.locate.LocatedExpression;
import com.raditha.signfix.model.FixRequest;
import com.raditha.signfix.model.FixResult;
import com.raditha.signfix.resolve.ConflictResolver;
import com.raditha.signfix.resolve.Resolution;
import com.raditha.signfix.resolve.TypeResolver;
import com.raditha.signfix.rewrite.ReconstructionException;
import com.raditha.signfix.rewrite.SourceReconstructor;
import com.raditha.signfix.session.Session;
import com.raditha.signfix.tree.ExprNode;
import com.raditha.signfix.tree.ExpressionTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves one flagged operator into a replacement line.
 * <p>
 * Failures of a single request never escape: they come back as a {@link FixResult} with
 * {@code success=false}.
 */
public class SignednessFixer {

    private static final Logger logger = LoggerFactory.getLogger(SignednessFixer.class);

    private final ExpressionLocator locator;
    private final SourceReconstructor reconstructor;
    private final boolean castOnTypeNameMismatch;

    public SignednessFixer(boolean castOnTypeNameMismatch) {
        this(new ExpressionLocator(), new SourceReconstructor(), castOnTypeNameMismatch);
    }

    public SignednessFixer(ExpressionLocator locator, SourceReconstructor reconstructor,
                           boolean castOnTypeNameMismatch) {
        this.locator = locator;
        this.reconstructor = reconstructor;
        this.castOnTypeNameMismatch = castOnTypeNameMismatch;
    }

    public FixResult fix(Session session, FixRequest request) {
        String original = session.sourceLine(request.lineNumber());
        LocatedExpression located;
        try {
            located = locator.locate(session, request);
        } catch (LocateException e) {
            logger.warn("{}: {}", request.reportId(), e.getMessage());
            return FixResult.failure(request, original, e.getMessage());
        }

        ExprNode tree = new ExpressionTreeBuilder(session.macros(), session.functions()).build(located.target());
        Resolution resolution = new ConflictResolver(new TypeResolver(session.types()), castOnTypeNameMismatch)
                .resolve(tree);
        if (!resolution.changed()) {
            logger.info("{}: no signedness conflict at line {}", request.reportId(), request.lineNumber());
            return new FixResult(request.reportId(), request.lineNumber(), true, original, original,
                    "No cast needed", resolution.casts());
        }

        try {
            String rewritten = reconstructor.reconstruct(located, resolution);
            logger.info("{}: line {} rewritten with {} cast(s)", request.reportId(), request.lineNumber(),
                    resolution.casts().size());
            return new FixResult(request.reportId(), request.lineNumber(), true, original, rewritten,
                    "Inserted " + resolution.casts().size() + " cast(s)", resolution.casts());
        } catch (ReconstructionException e) {
            logger.warn("{}: {}", request.reportId(), e.getMessage());
            return FixResult.unchanged(request, original, e.getMessage());
        }
    }
}
