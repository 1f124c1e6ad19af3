package quest.gekko.salesboard.service.exception;

public class NotFoundException extends SalesboardException {

    public NotFoundException(String what, Object id) {
        super("NOT_FOUND", what + " not found: " + id);
    }
}
