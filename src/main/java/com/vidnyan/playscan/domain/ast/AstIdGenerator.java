package com.vidnyan.playscan.domain.ast;

/**
 * Sequential node id source, one per build.
 * Ids depend only on walk order, so rebuilding the same input yields the same ids.
 */
public class AstIdGenerator {

    private int next;

    public String next() {
        return "ast-" + (++next);
    }
}
