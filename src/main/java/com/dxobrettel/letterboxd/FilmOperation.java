package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.UnknownOperationException;
import com.dxobrettel.letterboxd.model.FilmUserMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * The closed set of user actions the dispatcher can perform on a film. Toggle
 * operations carry the fixed status the dispatcher passes to their handler.
 */
public enum FilmOperation {

    ADD_TO_DIARY("Add to diary", Handler.DIARY, null),
    UPDATE_RATING("Update film rating", Handler.RATING, null),
    ADD_TO_LIKED("Add to Liked films", Handler.LIKED, true),
    REMOVE_FROM_LIKED("Remove from liked films", Handler.LIKED, false),
    MARK_WATCHED("Mark film as watched", Handler.WATCHED, true),
    UNMARK_WATCHED("Un-mark film as watched", Handler.WATCHED, false),
    ADD_TO_WATCHLIST("Add to watchlist", Handler.WATCHLIST, true),
    REMOVE_FROM_WATCHLIST("Remove from watchlist", Handler.WATCHLIST, false);

    public enum Handler {
        DIARY, RATING, LIKED, WATCHED, WATCHLIST
    }

    private final String label;
    private final Handler handler;
    private final Boolean status;

    FilmOperation(String label, Handler handler, Boolean status) {
        this.label = label;
        this.handler = handler;
        this.status = status;
    }

    public String label() {
        return label;
    }

    public Handler handler() {
        return handler;
    }

    /**
     * @return the fixed status injected by the dispatcher, or {@code null} for operations
     * that take caller-supplied arguments instead
     */
    public Boolean status() {
        return status;
    }

    public static FilmOperation fromLabel(String label) throws UnknownOperationException {
        if (label != null) {
            for (FilmOperation op : values()) {
                if (op.label.equalsIgnoreCase(label.trim())) {
                    return op;
                }
            }
        }
        throw new UnknownOperationException(label);
    }

    /**
     * Operations that make sense for a film in the given state, in menu order.
     */
    public static List<FilmOperation> availableFor(FilmUserMetadata metadata) {
        List<FilmOperation> ops = new ArrayList<>();
        ops.add(metadata.watched() ? UNMARK_WATCHED : MARK_WATCHED);
        ops.add(metadata.liked() ? REMOVE_FROM_LIKED : ADD_TO_LIKED);
        ops.add(metadata.watchlisted() ? REMOVE_FROM_WATCHLIST : ADD_TO_WATCHLIST);
        ops.add(UPDATE_RATING);
        ops.add(ADD_TO_DIARY);
        return ops;
    }

    @Override
    public String toString() {
        return label;
    }
}
