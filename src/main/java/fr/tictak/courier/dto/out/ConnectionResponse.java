package fr.tictak.courier.dto.out;

public record ConnectionResponse(String status, String sid) {

    public static ConnectionResponse connected(String sessionId) {
        return new ConnectionResponse("connected", sessionId);
    }
}
