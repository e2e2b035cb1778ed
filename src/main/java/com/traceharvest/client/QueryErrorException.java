package com.traceharvest.client;

/**
 * The backend answered but reported errors for the query itself.
 */
class QueryErrorException extends RuntimeException {

    QueryErrorException(String message) {
        super(message);
    }
}
