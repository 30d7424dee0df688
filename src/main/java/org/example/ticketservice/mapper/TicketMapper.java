package org.example.ticketservice.mapper;

import org.example.ticketservice.domain.AdminResponse;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.dto.TicketDTO;
import org.example.ticketservice.dto.TicketResponseDTO;
import org.example.ticketservice.entity.TicketEntity;
import org.example.ticketservice.entity.TicketResponseEntity;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TicketMapper {

    // ==================== ENTITY <-> DOMAIN ====================

    public Ticket toDomain(TicketEntity entity) {
        if (entity == null) {
            return null;
        }
        List<AdminResponse> responses = entity.getResponses().stream()
                .map(this::toDomain)
                .toList();

        return Ticket.restore(
                entity.getId(),
                entity.getTitle(),
                entity.getDescription(),
                entity.getUserId(),
                entity.getStatus(),
                entity.getPriority(),
                entity.getPriorityJustification(),
                responses,
                entity.getCreatedAt(),
                entity.getUpdatedAt());
    }

    public AdminResponse toDomain(TicketResponseEntity entity) {
        return AdminResponse.builder()
                .id(entity.getId())
                .text(entity.getText())
                .adminId(entity.getAdminId())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public TicketEntity toNewEntity(Ticket ticket) {
        TicketEntity entity = TicketEntity.builder()
                .title(ticket.getTitle())
                .description(ticket.getDescription())
                .userId(ticket.getUserId())
                .status(ticket.getStatus())
                .priority(ticket.getPriority())
                .priorityJustification(ticket.getPriorityJustification())
                .build();
        appendNewResponses(entity, ticket);
        return entity;
    }

    /**
     * Copies the mutable state of the aggregate onto a managed entity.
     * Responses are append-only, so only those without an id are added.
     */
    public void updateEntity(TicketEntity entity, Ticket ticket) {
        entity.setStatus(ticket.getStatus());
        entity.setPriority(ticket.getPriority());
        entity.setPriorityJustification(ticket.getPriorityJustification());
        appendNewResponses(entity, ticket);
    }

    private void appendNewResponses(TicketEntity entity, Ticket ticket) {
        ticket.getResponses().stream()
                .filter(response -> response.getId() == null)
                .map(response -> TicketResponseEntity.builder()
                        .text(response.getText())
                        .adminId(response.getAdminId())
                        .build())
                .forEach(entity::addResponse);
    }

    // ==================== DOMAIN -> DTO ====================

    public TicketDTO toDTO(Ticket ticket) {
        if (ticket == null) {
            return null;
        }
        return TicketDTO.builder()
                .id(ticket.getId())
                .title(ticket.getTitle())
                .description(ticket.getDescription())
                .status(ticket.getStatus())
                .priority(ticket.getPriority())
                .priorityJustification(ticket.getPriorityJustification())
                .userId(ticket.getUserId())
                .responses(toResponseDTOs(ticket))
                .createdAt(ticket.getCreatedAt())
                .updatedAt(ticket.getUpdatedAt())
                .build();
    }

    public List<TicketResponseDTO> toResponseDTOs(Ticket ticket) {
        return ticket.getResponses().stream()
                .map(response -> toDTO(ticket.getId(), response))
                .toList();
    }

    public TicketResponseDTO toDTO(Long ticketId, AdminResponse response) {
        return TicketResponseDTO.builder()
                .id(response.getId())
                .ticketId(ticketId)
                .text(response.getText())
                .adminId(response.getAdminId())
                .createdAt(response.getCreatedAt())
                .build();
    }
}
