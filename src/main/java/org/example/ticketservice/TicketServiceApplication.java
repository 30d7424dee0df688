package org.example.ticketservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Support Ticket Service.
 *
 * <p>This application provides:
 * <ul>
 *     <li>RESTful API for the ticket lifecycle (status, priority, admin responses)</li>
 *     <li>Domain events published after every persisted change</li>
 *     <li>A reconnecting RabbitMQ consumer reacting to assignment events</li>
 * </ul>
 */
@SpringBootApplication
public class TicketServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicketServiceApplication.class, args);
    }

}
