package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.LetterboxdException;
import com.dxobrettel.letterboxd.error.ValidationException;
import com.dxobrettel.letterboxd.model.DiaryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a named user action into the matching {@link FilmActions} call.
 *
 * <p>The session must be authenticated; otherwise the call fails before any request
 * is made. Handler failures propagate unchanged.
 */
public class OperationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OperationDispatcher.class);

    private final LetterboxdSession session;
    private final FilmActions actions;

    public OperationDispatcher(LetterboxdSession session, FilmActions actions) {
        this.session = session;
        this.actions = actions;
    }

    /**
     * Looks the operation up by its menu label, e.g. {@code "Add to watchlist"}.
     */
    public void perform(String operationName, String slug, Object... extraArgs) throws LetterboxdException, InterruptedException {
        session.requireAuthenticated("perform '" + operationName + "'");
        dispatch(FilmOperation.fromLabel(operationName), slug, extraArgs);
    }

    /**
     * @param extraArgs an {@link Integer} rating for {@link FilmOperation#UPDATE_RATING}; a
     *                  {@link DiaryEntry} or a form {@link Map} for {@link FilmOperation#ADD_TO_DIARY};
     *                  nothing for the toggles
     */
    public void perform(FilmOperation operation, String slug, Object... extraArgs) throws LetterboxdException, InterruptedException {
        session.requireAuthenticated("perform '" + operation.label() + "'");
        dispatch(operation, slug, extraArgs);
    }

    private void dispatch(FilmOperation operation, String slug, Object[] extraArgs) throws LetterboxdException, InterruptedException {
        log.info("Performing operation: {} on {}", operation.label(), slug);

        switch (operation.handler()) {
            case LIKED -> actions.setLikedStatus(slug, operation.status());
            case WATCHED -> actions.setWatchedStatus(slug, operation.status());
            case WATCHLIST -> actions.setWatchlistStatus(slug, operation.status());
            case RATING -> actions.setRating(slug, ratingArgument(operation, extraArgs));
            case DIARY -> performDiary(operation, slug, extraArgs);
        }
    }

    private void performDiary(FilmOperation operation, String slug, Object[] extraArgs) throws LetterboxdException, InterruptedException {
        Object arg = singleArgument(operation, extraArgs);
        if (arg instanceof DiaryEntry entry) {
            actions.addDiaryEntry(slug, entry);
        } else if (arg instanceof Map<?, ?> map) {
            actions.addDiaryEntry(slug, toFormMap(map));
        } else {
            throw new ValidationException("'" + operation.label() + "' expects a diary entry, got " + describe(arg));
        }
    }

    private static int ratingArgument(FilmOperation operation, Object[] extraArgs) throws ValidationException {
        Object arg = singleArgument(operation, extraArgs);
        if (arg instanceof Integer rating) {
            return rating;
        }
        throw new ValidationException("'" + operation.label() + "' expects an integer rating, got " + describe(arg));
    }

    private static Object singleArgument(FilmOperation operation, Object[] extraArgs) throws ValidationException {
        if (extraArgs == null || extraArgs.length != 1) {
            throw new ValidationException("'" + operation.label() + "' expects exactly one argument");
        }
        return extraArgs[0];
    }

    private static Map<String, Object> toFormMap(Map<?, ?> map) {
        Map<String, Object> form = new LinkedHashMap<>();
        map.forEach((k, v) -> form.put(String.valueOf(k), v));
        return form;
    }

    private static String describe(Object arg) {
        return arg == null ? "null" : arg.getClass().getSimpleName();
    }
}
